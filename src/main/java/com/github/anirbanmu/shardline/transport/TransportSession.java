package com.github.anirbanmu.shardline.transport;

// an open websocket. callers serialize their own writes.
public interface TransportSession {

    void sendText(String payload) throws TransportException;

    // graceful close frame; the service invalidates the session for 1000 and 1001
    void close(int code, String reason);

    // drop the tcp connection without a close frame
    void abort();
}
