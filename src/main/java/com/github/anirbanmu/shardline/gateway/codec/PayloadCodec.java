package com.github.anirbanmu.shardline.gateway.codec;

import com.github.anirbanmu.shardline.discord.json.GatewayEvent;
import com.github.anirbanmu.shardline.discord.json.GatewayEventParser;
import com.github.anirbanmu.shardline.discord.json.GatewayEventParser.ParseResult;
import com.github.anirbanmu.shardline.discord.json.Opcode;
import com.github.anirbanmu.shardline.discord.json.Ready;
import com.github.anirbanmu.shardline.util.Json;
import java.io.IOException;

// one instance per connection attempt; the inflate context lives exactly as long as the socket
public final class PayloadCodec {
    private final GatewayEventParser parser = new GatewayEventParser();
    private final ZlibStreamInflater inflater;

    public PayloadCodec(boolean compressed) {
        this.inflater = compressed ? new ZlibStreamInflater() : null;
    }

    public boolean compressed() {
        return inflater != null;
    }

    // null while a compressed message is still arriving
    public ParseResult decode(byte[] frame, boolean binary) throws ProtocolException {
        byte[] json = frame;
        if (binary) {
            if (inflater == null) {
                throw new ProtocolException("binary frame on an uncompressed connection");
            }
            json = inflater.feed(frame);
            if (json == null) {
                return null;
            }
        }
        try {
            return parser.parse(json);
        } catch (ProtocolException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new ProtocolException("malformed gateway payload: " + ex.getMessage(), ex);
        }
    }

    public Ready ready(GatewayEvent.Dispatch dispatch) throws ProtocolException {
        try {
            return parser.ready(dispatch);
        } catch (IOException | RuntimeException ex) {
            throw new ProtocolException("malformed READY: " + ex.getMessage(), ex);
        }
    }

    public static String encode(int op, Object data) throws IOException {
        return "{\"op\":" + op + ",\"d\":" + Json.write(data) + "}";
    }

    public static String heartbeat(Integer lastSequence) {
        return lastSequence == null
            ? "{\"op\":" + Opcode.HEARTBEAT + ",\"d\":null}"
            : "{\"op\":" + Opcode.HEARTBEAT + ",\"d\":" + lastSequence + "}";
    }

    public void close() {
        if (inflater != null) {
            inflater.close();
        }
    }
}
