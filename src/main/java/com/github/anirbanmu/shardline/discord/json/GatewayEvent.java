package com.github.anirbanmu.shardline.discord.json;

import java.io.IOException;

// sealed type for every inbound opcode we handle. dispatch data stays raw until someone asks for it.
public sealed interface GatewayEvent {

    record Hello(int heartbeatInterval) implements GatewayEvent {
    }

    record HeartbeatRequest() implements GatewayEvent {
    }

    record HeartbeatAck() implements GatewayEvent {
    }

    record Reconnect() implements GatewayEvent {
    }

    record InvalidSession(boolean resumable) implements GatewayEvent {
    }

    // frame holds the whole decoded (inflated) message
    record Dispatch(String type, Integer sequence, byte[] frame) implements GatewayEvent {

        // decodes d as the given type; null when d is absent or null
        public <T> T decode(Class<T> dataType) throws IOException {
            return GatewayEventParser.decodeData(frame, dataType);
        }
    }
}
