package com.github.anirbanmu.shardline.gateway;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.TreeSet;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

// identify quota shared by every shard of one manager. bucket = index % maxConcurrency,
// grants in a bucket are at least spacing apart, lowest waiting index first.
// expected shards get their first identify in index order; missing a turn by turnPatience forfeits it.
public final class IdentifyRateLimiter {
    static final Duration DEFAULT_TURN_PATIENCE = Duration.ofSeconds(5);

    private final int maxConcurrency;
    private final long spacingNanos;
    private final long patienceNanos;
    private final ReentrantLock lock = new ReentrantLock();
    private final Bucket[] buckets;

    private final class Bucket {
        final Condition changed = lock.newCondition();
        final PriorityQueue<Integer> waiting = new PriorityQueue<>();
        final TreeSet<Integer> expected = new TreeSet<>();
        boolean granted;
        long lastGrantAt;
        // when the lowest expected shard's turn started
        long turnSince;
    }

    public IdentifyRateLimiter(int maxConcurrency, Duration spacing) {
        this(maxConcurrency, spacing, DEFAULT_TURN_PATIENCE);
    }

    public IdentifyRateLimiter(int maxConcurrency, Duration spacing, Duration turnPatience) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.spacingNanos = spacing.toNanos();
        this.patienceNanos = turnPatience.toNanos();
        this.buckets = new Bucket[maxConcurrency];
        for (int i = 0; i < maxConcurrency; i++) {
            buckets[i] = new Bucket();
        }
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public int bucketOf(int shardIndex) {
        return shardIndex % maxConcurrency;
    }

    // reserve a first-round turn for this shard
    public void expect(int shardIndex) {
        Bucket bucket = buckets[bucketOf(shardIndex)];
        lock.lock();
        try {
            if (bucket.expected.isEmpty()) {
                bucket.turnSince = System.nanoTime();
            }
            bucket.expected.add(shardIndex);
        } finally {
            lock.unlock();
        }
    }

    // a stopped shard must not hold up the ones behind it
    public void forget(int shardIndex) {
        Bucket bucket = buckets[bucketOf(shardIndex)];
        lock.lock();
        try {
            if (bucket.expected.remove(shardIndex)) {
                bucket.turnSince = System.nanoTime();
                bucket.changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    // blocks until this shard may identify. an interrupted waiter leaves the line.
    public void acquire(int shardIndex) throws InterruptedException {
        Bucket bucket = buckets[bucketOf(shardIndex)];
        lock.lock();
        try {
            bucket.waiting.add(shardIndex);
            try {
                while (true) {
                    if (bucket.waiting.peek().intValue() != shardIndex) {
                        bucket.changed.await();
                        continue;
                    }
                    long now = System.nanoTime();
                    long wait = bucket.granted ? bucket.lastGrantAt + spacingNanos - now : 0;
                    if (wait > 0) {
                        bucket.changed.awaitNanos(wait);
                        continue;
                    }
                    if (!bucket.expected.isEmpty() && bucket.expected.first() < shardIndex) {
                        // a lower shard has the turn but hasn't asked yet
                        long patience = bucket.turnSince + patienceNanos - now;
                        if (patience > 0) {
                            bucket.changed.awaitNanos(patience);
                        } else {
                            bucket.expected.pollFirst();
                            bucket.turnSince = now;
                        }
                        continue;
                    }
                    bucket.waiting.poll();
                    bucket.granted = true;
                    bucket.lastGrantAt = now;
                    if (bucket.expected.remove(shardIndex)) {
                        bucket.turnSince = now + spacingNanos;
                    }
                    bucket.changed.signalAll();
                    return;
                }
            } catch (InterruptedException ex) {
                bucket.waiting.remove(shardIndex);
                bucket.changed.signalAll();
                throw ex;
            }
        } finally {
            lock.unlock();
        }
    }

    int waiting(int bucket) {
        lock.lock();
        try {
            return buckets[bucket].waiting.size();
        } finally {
            lock.unlock();
        }
    }
}
