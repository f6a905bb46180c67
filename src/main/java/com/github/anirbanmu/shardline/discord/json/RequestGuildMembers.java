package com.github.anirbanmu.shardline.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// opcode 8 - members arrive as GUILD_MEMBERS_CHUNK dispatches on the guild's shard
@CompiledJson
public record RequestGuildMembers(@JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(nullable = true) String query, int limit, @JsonAttribute(nullable = true) Boolean presences, @JsonAttribute(name = "user_ids", nullable = true) List<String> userIds, @JsonAttribute(nullable = true) String nonce) {

    // all members whose username starts with query ("" = everyone)
    public static RequestGuildMembers byQuery(String guildId, String query, int limit) {
        return new RequestGuildMembers(guildId, query, limit, null, null, null);
    }

    public static RequestGuildMembers byIds(String guildId, List<String> userIds) {
        return new RequestGuildMembers(guildId, null, 0, null, List.copyOf(userIds), null);
    }
}
