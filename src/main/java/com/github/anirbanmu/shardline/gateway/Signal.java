package com.github.anirbanmu.shardline.gateway;

// everything the shard driver reacts to. each carries the connection id of the socket that produced it.
sealed interface Signal {

    long connectionId();

    record Frame(long connectionId, byte[] data, boolean binary) implements Signal {
    }

    record Closed(long connectionId, int code, String reason) implements Signal {
    }

    record Failed(long connectionId, Throwable error) implements Signal {
    }

    record HeartbeatTick(long connectionId) implements Signal {
    }

    record IdentifyGranted(long connectionId) implements Signal {
    }
}
