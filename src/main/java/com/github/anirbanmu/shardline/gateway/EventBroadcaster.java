package com.github.anirbanmu.shardline.gateway;

import java.util.concurrent.CopyOnWriteArrayList;

// fan-out of dispatch events to every open EventStream. a full subscriber blocks the publishing shard.
public final class EventBroadcaster {
    private final int capacity;
    private final CopyOnWriteArrayList<EventStream> subscribers = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public EventBroadcaster(int capacity) {
        this.capacity = capacity;
    }

    public EventStream subscribe() {
        EventStream stream = new EventStream(this, capacity);
        subscribers.add(stream);
        if (closed) {
            stream.finish();
        }
        return stream;
    }

    // called by shard drivers; per-shard order is the call order
    public void publish(DispatchEvent event) throws InterruptedException {
        if (closed) {
            return;
        }
        for (EventStream stream : subscribers) {
            stream.put(event);
        }
    }

    // streams drain what they already have, then end
    public void close() {
        closed = true;
        for (EventStream stream : subscribers) {
            stream.finish();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    int subscriberCount() {
        return subscribers.size();
    }

    void unsubscribe(EventStream stream) {
        subscribers.remove(stream);
    }
}
