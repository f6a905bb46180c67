package com.github.anirbanmu.shardline.config;

import com.github.anirbanmu.shardline.discord.json.Intent;
import com.github.anirbanmu.shardline.discord.json.UpdatePresence;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

public class ConfigLoader {
    public static GatewayConfig load(Path path) throws IOException {
        TomlParseResult result = Toml.parse(path);
        return parse(result);
    }

    public static GatewayConfig load(InputStream stream) throws IOException {
        TomlParseResult result = Toml.parse(stream);
        return parse(result);
    }

    public static GatewayConfig load(String content) {
        TomlParseResult result = Toml.parse(content);
        return parse(result);
    }

    private static GatewayConfig parse(TomlParseResult result) {
        if (result.hasErrors()) {
            StringBuilder sb = new StringBuilder("Failed to parse TOML configuration:\n");
            result.errors().forEach(error -> sb.append("- ").append(error.toString()).append("\n"));
            throw new ConfigException(sb.toString());
        }

        GatewayConfig defaults = GatewayConfig.defaults();

        int intents = 0;
        if (result.contains("intents")) {
            if (!result.isArray("intents")) {
                throw new ConfigException("'intents' must be an array of intent names.");
            }
            List<Intent> parsed = new ArrayList<>();
            for (Object value : result.getArray("intents").toList()) {
                try {
                    parsed.add(Intent.fromString(value.toString()));
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("intents: " + e.getMessage());
                }
            }
            intents = Intent.mask(parsed);
        }

        String gatewayUrl = result.getString("default_gateway_url");
        if (gatewayUrl == null || gatewayUrl.isBlank()) {
            gatewayUrl = defaults.defaultGatewayUrl();
        } else if (!gatewayUrl.startsWith("wss://") && !gatewayUrl.startsWith("ws://")) {
            throw new ConfigException("'default_gateway_url' must be a ws:// or wss:// url, got: " + gatewayUrl);
        }

        UpdatePresence presence = null;
        if (result.isTable("presence")) {
            presence = parsePresence(result.getTable("presence"));
        }

        return new GatewayConfig(
            intValue(result, "api_version", defaults.apiVersion()),
            intents,
            intValue(result, "shard_count", defaults.shardCount()),
            result.getBoolean("compression", () -> defaults.compression()),
            intValue(result, "large_threshold", defaults.largeThreshold()),
            gatewayUrl,
            presence,
            duration(result, "connect_timeout", defaults.connectTimeout()),
            duration(result, "backoff_min", defaults.backoffMin()),
            duration(result, "backoff_max", defaults.backoffMax()),
            duration(result, "identify_spacing", defaults.identifySpacing()),
            intValue(result, "stable_ready_heartbeats", defaults.stableReadyHeartbeats()),
            intValue(result, "event_buffer", defaults.eventBuffer()));
    }

    private static UpdatePresence parsePresence(TomlTable table) {
        String status = table.getString("status");
        if (status == null) {
            status = UpdatePresence.STATUS_ONLINE;
        }
        status = status.toLowerCase(Locale.ROOT);
        switch (status) {
            case UpdatePresence.STATUS_ONLINE, UpdatePresence.STATUS_DND, UpdatePresence.STATUS_IDLE,
                UpdatePresence.STATUS_INVISIBLE, UpdatePresence.STATUS_OFFLINE -> {
            }
            default -> throw new ConfigException("presence: unknown status '" + status + "'");
        }

        boolean afk = table.getBoolean("afk", () -> false);

        List<UpdatePresence.Activity> activities = List.of();
        String activity = table.getString("activity");
        if (activity != null && !activity.isBlank()) {
            Long type = table.getLong("activity_type");
            activities = List.of(new UpdatePresence.Activity(activity,
                type == null ? UpdatePresence.Activity.TYPE_PLAYING : Math.toIntExact(type)));
        }

        return new UpdatePresence(null, activities, status, afk);
    }

    private static int intValue(TomlParseResult result, String key, int fallback) {
        if (!result.contains(key)) {
            return fallback;
        }
        if (!result.isLong(key)) {
            throw new ConfigException("'" + key + "' must be an integer.");
        }
        return Math.toIntExact(result.getLong(key));
    }

    // ISO-8601 durations, e.g. "PT10S", "PT0.5S"
    private static Duration duration(TomlParseResult result, String key, Duration fallback) {
        String value = result.getString(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new ConfigException("'" + key + "' is not a valid ISO-8601 duration: " + value);
        }
    }
}
