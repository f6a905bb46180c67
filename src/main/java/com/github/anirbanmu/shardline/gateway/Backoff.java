package com.github.anirbanmu.shardline.gateway;

import java.time.Duration;

// min * 2^(attempt-1), capped at max
final class Backoff {
    private final long minMs;
    private final long maxMs;
    private int attempt;

    Backoff(Duration min, Duration max) {
        this.minMs = min.toMillis();
        this.maxMs = max.toMillis();
    }

    long nextDelayMs() {
        attempt++;
        return delayMs(attempt);
    }

    long delayMs(int attempt) {
        if (attempt <= 0) {
            return 0;
        }
        int shift = Math.min(attempt - 1, 30);
        long delay = minMs << shift;
        if (delay < 0 || delay > maxMs || (minMs > 0 && (delay >> shift) != minMs)) {
            return maxMs;
        }
        return delay;
    }

    int attempt() {
        return attempt;
    }

    void reset() {
        attempt = 0;
    }
}
