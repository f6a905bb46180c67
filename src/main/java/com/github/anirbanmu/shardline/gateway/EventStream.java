package com.github.anirbanmu.shardline.gateway;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

// one subscriber's view of the dispatch events. ends once the manager has stopped and the backlog is drained.
public final class EventStream implements Iterator<DispatchEvent>, AutoCloseable {
    private static final long POLL_MS = 100;

    private final EventBroadcaster broadcaster;
    private final BlockingQueue<DispatchEvent> queue;
    private volatile boolean finished;
    private volatile boolean cancelled;
    private DispatchEvent next;

    EventStream(EventBroadcaster broadcaster, int capacity) {
        this.broadcaster = broadcaster;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    void put(DispatchEvent event) throws InterruptedException {
        if (!cancelled) {
            queue.put(event);
        }
    }

    void finish() {
        finished = true;
    }

    // blocks until an event arrives or the stream ends
    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        try {
            while (!cancelled) {
                next = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (next != null) {
                    return true;
                }
                if (finished && queue.isEmpty()) {
                    return false;
                }
            }
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public DispatchEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("event stream ended");
        }
        DispatchEvent event = next;
        next = null;
        return event;
    }

    public Stream<DispatchEvent> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(this::close);
    }

    // stop receiving; unblocks a shard waiting on this subscriber
    @Override
    public void close() {
        cancelled = true;
        broadcaster.unsubscribe(this);
        queue.clear();
    }
}
