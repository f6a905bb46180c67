package com.github.anirbanmu.shardline.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.dslplatform.json.JsonReader;
import com.github.anirbanmu.shardline.util.Json;
import java.io.IOException;

// parses raw gateway json into typed GatewayEvent
public final class GatewayEventParser {

    public GatewayEventParser() {
    }

    public record ParseResult(GatewayEvent event, Integer sequence) {
    }

    // event is null for opcodes a client never receives
    public ParseResult parse(byte[] raw) throws IOException {
        // first pass: get op, s, t
        Envelope envelope = Json.DSL.deserialize(Envelope.class, raw, raw.length);
        if (envelope == null) {
            throw new IOException("empty gateway payload");
        }

        // second pass: typed deserialization of d where it's small and always needed
        GatewayEvent event = switch (envelope.op()) {
            case Opcode.HELLO -> {
                HelloMsg msg = Json.DSL.deserialize(HelloMsg.class, raw, raw.length);
                if (msg.d() == null || msg.d().heartbeatInterval() <= 0) {
                    throw new IOException("hello without heartbeat_interval");
                }
                yield new GatewayEvent.Hello(msg.d().heartbeatInterval());
            }
            case Opcode.HEARTBEAT -> new GatewayEvent.HeartbeatRequest();
            case Opcode.HEARTBEAT_ACK -> new GatewayEvent.HeartbeatAck();
            case Opcode.RECONNECT -> new GatewayEvent.Reconnect();
            case Opcode.INVALID_SESSION -> {
                InvalidSessionMsg msg = Json.DSL.deserialize(InvalidSessionMsg.class, raw, raw.length);
                yield new GatewayEvent.InvalidSession(msg.d());
            }
            case Opcode.DISPATCH -> {
                if (envelope.t() == null) {
                    throw new IOException("dispatch without event type");
                }
                yield new GatewayEvent.Dispatch(envelope.t(), envelope.s(), raw);
            }
            default -> null;
        };

        return new ParseResult(event, envelope.s());
    }

    // whole-frame read of READY, the one dispatch the state machine depends on
    public Ready ready(GatewayEvent.Dispatch dispatch) throws IOException {
        byte[] frame = dispatch.frame();
        ReadyMsg msg = Json.DSL.deserialize(ReadyMsg.class, frame, frame.length);
        if (msg == null || msg.d() == null || msg.d().sessionId() == null) {
            throw new IOException("READY without session_id");
        }
        return msg.d();
    }

    // walks the top-level object and reads only d, skipping everything else
    static <T> T decodeData(byte[] frame, Class<T> dataType) throws IOException {
        JsonReader<Object> reader = Json.DSL.newReader(frame);
        if (reader.getNextToken() != '{') {
            throw new IOException("gateway payload is not an object");
        }
        if (reader.getNextToken() == '}') {
            return null;
        }
        while (true) {
            String key = reader.readKey();
            if ("d".equals(key)) {
                if (reader.wasNull()) {
                    return null;
                }
                return reader.next(dataType);
            }
            if (reader.skip() != ',') {
                return null;
            }
            reader.getNextToken();
        }
    }

    // wire format records - private implementation details

    @CompiledJson
    record Envelope(int op, @JsonAttribute(nullable = true) Integer s, @JsonAttribute(nullable = true) String t) {
    }

    @CompiledJson
    record HelloMsg(int op, @JsonAttribute(nullable = true) HelloData d) {
    }

    @CompiledJson
    record HelloData(@JsonAttribute(name = "heartbeat_interval") int heartbeatInterval) {
    }

    @CompiledJson
    record InvalidSessionMsg(int op, @JsonAttribute(name = "d") boolean d) {
    }

    @CompiledJson
    record ReadyMsg(int op, @JsonAttribute(nullable = true) Ready d) {
    }
}
