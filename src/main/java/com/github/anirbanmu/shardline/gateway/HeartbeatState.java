package com.github.anirbanmu.shardline.gateway;

// only touched from the shard's driver thread
final class HeartbeatState {

    enum TickAction {
        SEND,
        // a backlog tick right after a send, nothing to judge yet
        SKIP,
        ZOMBIED
    }

    private final long intervalMs;
    private final long graceNanos;
    private boolean acked = true;
    private long lastSentAt;
    private int missed;

    HeartbeatState(long intervalMs) {
        this.intervalMs = intervalMs;
        this.graceNanos = intervalMs * 1_000_000L / 2;
    }

    long intervalMs() {
        return intervalMs;
    }

    TickAction onTick(long now) {
        if (acked) {
            return TickAction.SEND;
        }
        if (now - lastSentAt < graceNanos) {
            return TickAction.SKIP;
        }
        missed++;
        return TickAction.ZOMBIED;
    }

    // the next tick must see an ack for this send
    void sent(long now) {
        acked = false;
        lastSentAt = now;
    }

    void acked() {
        acked = true;
        missed = 0;
    }

    int missed() {
        return missed;
    }
}
