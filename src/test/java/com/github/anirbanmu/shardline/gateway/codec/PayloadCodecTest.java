package com.github.anirbanmu.shardline.gateway.codec;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.shardline.discord.json.GatewayEvent;
import com.github.anirbanmu.shardline.discord.json.GatewayEventParser.ParseResult;
import com.github.anirbanmu.shardline.discord.json.Opcode;
import com.github.anirbanmu.shardline.discord.json.Ready;
import com.github.anirbanmu.shardline.discord.json.Resume;
import java.nio.charset.StandardCharsets;
import java.util.zip.Deflater;
import org.junit.jupiter.api.Test;

class PayloadCodecTest {

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void decodesTextFrames() throws Exception {
        PayloadCodec codec = new PayloadCodec(false);

        ParseResult result = codec.decode(bytes("{\"op\":10,\"d\":{\"heartbeat_interval\":45000}}"), false);

        assertFalse(codec.compressed());
        assertEquals(45000, ((GatewayEvent.Hello) result.event()).heartbeatInterval());
    }

    @Test
    void binaryFrameOnUncompressedConnectionIsProtocolError() {
        PayloadCodec codec = new PayloadCodec(false);

        assertThrows(ProtocolException.class, () -> codec.decode(new byte[]{1, 2, 3}, true));
    }

    @Test
    void malformedJsonIsProtocolError() {
        PayloadCodec codec = new PayloadCodec(false);

        assertThrows(ProtocolException.class, () -> codec.decode(bytes("not json"), false));
    }

    @Test
    void decodesCompressedFrames() throws Exception {
        Deflater deflater = new Deflater();
        PayloadCodec codec = new PayloadCodec(true);
        try {
            String ready = "{\"op\":0,\"t\":\"READY\",\"s\":1,\"d\":{\"session_id\":\"s-1\",\"resume_gateway_url\":\"wss://resume.test\"}}";

            ParseResult result = codec.decode(ZlibStreamInflaterTest.compress(deflater, ready), true);
            Ready decoded = codec.ready((GatewayEvent.Dispatch) result.event());

            assertTrue(codec.compressed());
            assertEquals(1, result.sequence());
            assertEquals("s-1", decoded.sessionId());
            assertEquals("wss://resume.test", decoded.resumeGatewayUrl());
        } finally {
            deflater.end();
            codec.close();
        }
    }

    @Test
    void partialCompressedFrameYieldsNothing() throws Exception {
        PayloadCodec codec = new PayloadCodec(true);
        try {
            assertNull(codec.decode(new byte[]{0x78, (byte) 0x9c}, true));
        } finally {
            codec.close();
        }
    }

    @Test
    void encodeWrapsOpAndData() throws Exception {
        String json = PayloadCodec.encode(Opcode.RESUME, new Resume("tok", "abc", null));

        assertTrue(json.startsWith("{\"op\":6,\"d\":{"));
        assertTrue(json.contains("\"session_id\":\"abc\""));
        assertTrue(json.endsWith("}}"));
    }

    @Test
    void heartbeatCarriesLastSequence() {
        assertEquals("{\"op\":1,\"d\":null}", PayloadCodec.heartbeat(null));
        assertEquals("{\"op\":1,\"d\":251}", PayloadCodec.heartbeat(251));
    }
}
