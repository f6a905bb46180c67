package com.github.anirbanmu.shardline.transport;

import java.io.IOException;

// handshake or socket failure. always worth a resume attempt.
public class TransportException extends IOException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
