package com.github.anirbanmu.shardline.transport;

import java.net.URI;
import java.time.Duration;

// opens websocket sessions. one session per shard connection attempt.
public interface Transport {

    // blocks until the handshake completes, fails, or times out
    TransportSession open(URI uri, Duration handshakeTimeout, TransportListener listener) throws TransportException, InterruptedException;
}
