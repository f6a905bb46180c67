package com.github.anirbanmu.shardline.config;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.shardline.discord.json.UpdatePresence;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {

    @Test
    void testLoadConfig() {
        String toml = """
            api_version = 10
            intents = ["GUILDS", "GUILD_MESSAGES", "message_content"]
            shard_count = 4
            compression = true
            large_threshold = 100
            default_gateway_url = "wss://gateway.example.test"
            connect_timeout = "PT5S"
            backoff_min = "PT0.5S"
            backoff_max = "PT30S"
            identify_spacing = "PT5.5S"
            stable_ready_heartbeats = 2
            event_buffer = 64

            [presence]
            status = "dnd"
            afk = false
            activity = "the gateway"
            activity_type = 3
            """;

        GatewayConfig config = ConfigLoader.load(toml);

        assertNotNull(config);
        assertEquals(10, config.apiVersion());
        assertEquals(1 | (1 << 9) | (1 << 15), config.intents());
        assertEquals(4, config.shardCount());
        assertTrue(config.compression());
        assertEquals(100, config.largeThreshold());
        assertEquals("wss://gateway.example.test", config.defaultGatewayUrl());
        assertEquals(Duration.ofSeconds(5), config.connectTimeout());
        assertEquals(Duration.ofMillis(500), config.backoffMin());
        assertEquals(Duration.ofSeconds(30), config.backoffMax());
        assertEquals(Duration.ofMillis(5500), config.identifySpacing());
        assertEquals(2, config.stableReadyHeartbeats());
        assertEquals(64, config.eventBuffer());

        UpdatePresence presence = config.presence();
        assertNotNull(presence);
        assertEquals(UpdatePresence.STATUS_DND, presence.status());
        assertFalse(presence.afk());
        assertEquals(1, presence.activities().size());
        assertEquals("the gateway", presence.activities().get(0).name());
        assertEquals(UpdatePresence.Activity.TYPE_WATCHING, presence.activities().get(0).type());
    }

    @Test
    void testEmptyConfigUsesDefaults() {
        GatewayConfig config = ConfigLoader.load("");

        assertEquals(GatewayConfig.defaults(), config);
        assertEquals(0, config.shardCount()); // 0 = use the recommended count
        assertFalse(config.compression());
        assertNull(config.presence());
    }

    @Test
    void testLoadFromStream() throws Exception {
        String toml = """
            intents = ["GUILDS"]
            """;

        GatewayConfig config = ConfigLoader.load(new ByteArrayInputStream(toml.getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, config.intents());
    }

    @Test
    void testPresenceDefaults() {
        String toml = """
            [presence]
            activity = "with shards"
            """;

        UpdatePresence presence = ConfigLoader.load(toml).presence();

        assertEquals(UpdatePresence.STATUS_ONLINE, presence.status());
        assertEquals(UpdatePresence.Activity.TYPE_PLAYING, presence.activities().get(0).type());
    }

    @Test
    void testUnknownIntentRejected() {
        String toml = """
            intents = ["GUILDS", "EVERYTHING"]
            """;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(toml));

        assertTrue(exception.getMessage().contains("EVERYTHING"),
            "Exception should mention the bad intent, got: " + exception.getMessage());
    }

    @Test
    void testUnknownStatusRejected() {
        String toml = """
            [presence]
            status = "busy"
            """;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(toml));

        assertTrue(exception.getMessage().contains("unknown status 'busy'"),
            "Exception should mention the bad status, got: " + exception.getMessage());
    }

    @Test
    void testLargeThresholdOutOfRange() {
        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load("large_threshold = 300"));

        assertTrue(exception.getMessage().contains("large_threshold"));
    }

    @Test
    void testNonIntegerRejected() {
        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load("shard_count = \"four\""));

        assertTrue(exception.getMessage().contains("'shard_count' must be an integer"),
            "got: " + exception.getMessage());
    }

    @Test
    void testBadGatewayUrlRejected() {
        ConfigException exception = assertThrows(ConfigException.class,
            () -> ConfigLoader.load("default_gateway_url = \"https://gateway.discord.gg\""));

        assertTrue(exception.getMessage().contains("default_gateway_url"));
    }

    @Test
    void testBadDurationRejected() {
        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load("backoff_min = \"5 seconds\""));

        assertTrue(exception.getMessage().contains("backoff_min"));
    }

    @Test
    void testBackoffBoundsChecked() {
        String toml = """
            backoff_min = "PT10S"
            backoff_max = "PT1S"
            """;

        assertThrows(ConfigException.class, () -> ConfigLoader.load(toml));
    }

    @Test
    void testSyntaxErrorReported() {
        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load("intents = ["));

        assertTrue(exception.getMessage().startsWith("Failed to parse TOML configuration"));
    }
}
