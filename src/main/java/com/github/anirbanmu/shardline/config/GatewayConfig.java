package com.github.anirbanmu.shardline.config;

import com.github.anirbanmu.shardline.discord.json.UpdatePresence;
import java.time.Duration;

// shardCount = 0 means use the count discord recommends
public record GatewayConfig(
    int apiVersion,
    int intents,
    int shardCount,
    boolean compression,
    int largeThreshold,
    String defaultGatewayUrl,
    UpdatePresence presence,
    Duration connectTimeout,
    Duration backoffMin,
    Duration backoffMax,
    Duration identifySpacing,
    int stableReadyHeartbeats,
    int eventBuffer) {

    public static final int DEFAULT_API_VERSION = 10;
    public static final String DEFAULT_GATEWAY_URL = "wss://gateway.discord.gg";

    public GatewayConfig {
        if (shardCount < 0) {
            throw new ConfigException("shard_count must be >= 0, got " + shardCount);
        }
        if (largeThreshold < 50 || largeThreshold > 250) {
            throw new ConfigException("large_threshold must be between 50 and 250, got " + largeThreshold);
        }
        if (backoffMin.isNegative() || backoffMax.compareTo(backoffMin) < 0) {
            throw new ConfigException("backoff_max must be >= backoff_min >= 0");
        }
        if (stableReadyHeartbeats < 1) {
            throw new ConfigException("stable_ready_heartbeats must be >= 1");
        }
        if (eventBuffer < 1) {
            throw new ConfigException("event_buffer must be >= 1");
        }
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig(
            DEFAULT_API_VERSION,
            0,
            0,
            false,
            50,
            DEFAULT_GATEWAY_URL,
            null,
            Duration.ofSeconds(10),
            Duration.ofSeconds(1),
            Duration.ofSeconds(60),
            Duration.ofSeconds(5),
            3,
            256);
    }
}
