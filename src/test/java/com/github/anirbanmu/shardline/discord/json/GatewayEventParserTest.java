package com.github.anirbanmu.shardline.discord.json;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.shardline.discord.json.GatewayEventParser.ParseResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class GatewayEventParserTest {

    private final GatewayEventParser parser = new GatewayEventParser();

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void parseHello() throws Exception {
        String json = """
            {"op": 10, "t": null, "s": null, "d": {"heartbeat_interval": 41250}}
            """;

        ParseResult result = parser.parse(bytes(json));

        assertNull(result.sequence());
        assertInstanceOf(GatewayEvent.Hello.class, result.event());
        assertEquals(41250, ((GatewayEvent.Hello) result.event()).heartbeatInterval());
    }

    @Test
    void helloWithoutIntervalIsRejected() {
        String json = """
            {"op": 10, "d": {}}
            """;

        assertThrows(IOException.class, () -> parser.parse(bytes(json)));
    }

    @Test
    void parseDispatchKeepsTypeSequenceAndFrame() throws Exception {
        String json = """
            {"op": 0, "t": "MESSAGE_CREATE", "s": 42, "d": {"id": "1", "content": "hi"}}
            """;

        ParseResult result = parser.parse(bytes(json));

        assertEquals(42, result.sequence());
        GatewayEvent.Dispatch dispatch = assertInstanceOf(GatewayEvent.Dispatch.class, result.event());
        assertEquals("MESSAGE_CREATE", dispatch.type());
        assertEquals(42, dispatch.sequence());
        assertArrayEquals(bytes(json), dispatch.frame());
    }

    @Test
    void dispatchWithoutTypeIsRejected() {
        String json = """
            {"op": 0, "s": 3, "d": {}}
            """;

        assertThrows(IOException.class, () -> parser.parse(bytes(json)));
    }

    @Test
    void parseHeartbeatRequest() throws Exception {
        String json = """
            {"op": 1, "d": null}
            """;

        ParseResult result = parser.parse(bytes(json));
        assertInstanceOf(GatewayEvent.HeartbeatRequest.class, result.event());
    }

    @Test
    void parseHeartbeatAck() throws Exception {
        String json = """
            {"op": 11}
            """;

        ParseResult result = parser.parse(bytes(json));
        assertInstanceOf(GatewayEvent.HeartbeatAck.class, result.event());
    }

    @Test
    void parseReconnect() throws Exception {
        String json = """
            {"op": 7, "d": null}
            """;

        ParseResult result = parser.parse(bytes(json));
        assertInstanceOf(GatewayEvent.Reconnect.class, result.event());
    }

    @Test
    void parseInvalidSession() throws Exception {
        ParseResult notResumable = parser.parse(bytes("{\"op\": 9, \"d\": false}"));
        ParseResult resumable = parser.parse(bytes("{\"op\": 9, \"d\": true}"));

        assertFalse(((GatewayEvent.InvalidSession) notResumable.event()).resumable());
        assertTrue(((GatewayEvent.InvalidSession) resumable.event()).resumable());
    }

    @Test
    void unknownOpcodeHasNoEvent() throws Exception {
        ParseResult result = parser.parse(bytes("{\"op\": 42, \"d\": {}}"));

        assertNull(result.event());
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(IOException.class, () -> parser.parse(bytes("{\"op\": ")));
    }

    @Test
    void parseReady() throws Exception {
        String json = """
            {"op": 0, "t": "READY", "s": 1, "d": {"v": 10, "user": {"id": "9"}, "session_id": "abc123", "resume_gateway_url": "wss://resume.discord.gg", "guilds": []}}
            """;

        ParseResult result = parser.parse(bytes(json));
        GatewayEvent.Dispatch dispatch = (GatewayEvent.Dispatch) result.event();
        Ready ready = parser.ready(dispatch);

        assertEquals(1, result.sequence());
        assertEquals("abc123", ready.sessionId());
        assertEquals("wss://resume.discord.gg", ready.resumeGatewayUrl());
    }

    @Test
    void readyWithoutSessionIsRejected() throws Exception {
        String json = """
            {"op": 0, "t": "READY", "s": 1, "d": {"v": 10}}
            """;

        GatewayEvent.Dispatch dispatch = (GatewayEvent.Dispatch) parser.parse(bytes(json)).event();

        assertThrows(IOException.class, () -> parser.ready(dispatch));
    }

    @Test
    void decodeDispatchData() throws Exception {
        String json = """
            {"t": "VOICE_STATE_UPDATE", "s": 8, "op": 0, "d": {"guild_id": "41771983423143937", "channel_id": null, "self_mute": true, "self_deaf": false, "session_id": "x"}}
            """;

        GatewayEvent.Dispatch dispatch = (GatewayEvent.Dispatch) parser.parse(bytes(json)).event();
        UpdateVoiceState state = dispatch.decode(UpdateVoiceState.class);

        assertEquals("41771983423143937", state.guildId());
        assertNull(state.channelId());
        assertTrue(state.selfMute());
        assertFalse(state.selfDeaf());
    }

    @Test
    void decodeNullDataReturnsNull() throws Exception {
        String json = """
            {"op": 0, "t": "SOMETHING", "s": 2, "d": null}
            """;

        GatewayEvent.Dispatch dispatch = (GatewayEvent.Dispatch) parser.parse(bytes(json)).event();

        assertNull(dispatch.decode(UpdateVoiceState.class));
    }
}
