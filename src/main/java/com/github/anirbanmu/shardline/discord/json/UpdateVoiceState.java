package com.github.anirbanmu.shardline.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// opcode 4 - join, move or leave (channelId = null) a voice channel
@CompiledJson
public record UpdateVoiceState(@JsonAttribute(name = "guild_id") String guildId, @JsonAttribute(name = "channel_id", nullable = true) String channelId, @JsonAttribute(name = "self_mute") boolean selfMute, @JsonAttribute(name = "self_deaf") boolean selfDeaf) {
}
