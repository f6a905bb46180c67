package com.github.anirbanmu.shardline.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// opcode 2 identify payload - sent after receiving hello when there is no session to resume.
// compress refers to per-payload compression, which is never used; transport compression
// is negotiated through the connect url instead.
@CompiledJson
public record Identify(String token, int intents, Properties properties, int[] shard, @JsonAttribute(nullable = true) UpdatePresence presence, boolean compress, @JsonAttribute(name = "large_threshold") int largeThreshold) {

    public static Identify create(String token, int intents, int shardIndex, int shardCount, UpdatePresence presence, int largeThreshold) {
        return new Identify(token, intents, Properties.DEFAULT, new int[]{shardIndex, shardCount}, presence, false, largeThreshold);
    }

    // connection properties for identify
    @CompiledJson
    public record Properties(String os, String browser, String device) {
        public static final Properties DEFAULT = new Properties(System.getProperty("os.name", "linux").toLowerCase(), "shardline", "shardline");
    }
}
