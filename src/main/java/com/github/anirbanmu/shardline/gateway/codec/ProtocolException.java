package com.github.anirbanmu.shardline.gateway.codec;

import java.io.IOException;

// malformed envelope or corrupt compressed stream. the connection's state can't be trusted after this.
public class ProtocolException extends IOException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
