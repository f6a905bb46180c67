package com.github.anirbanmu.shardline.discord;

import com.github.anirbanmu.shardline.discord.json.GatewayBot;

// where the manager learns the gateway url, recommended shard count and identify concurrency
@FunctionalInterface
public interface GatewayBotSource {
    DiscordResult<GatewayBot> getGatewayBot();
}
