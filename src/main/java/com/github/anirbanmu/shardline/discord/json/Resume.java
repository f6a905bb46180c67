package com.github.anirbanmu.shardline.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// opcode 6 resume payload - replays everything after seq on the old session
@CompiledJson
public record Resume(String token, @JsonAttribute(name = "session_id") String sessionId, @JsonAttribute(nullable = true) Integer seq) {
}
