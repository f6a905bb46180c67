package com.github.anirbanmu.shardline.transport;

// callbacks arrive on transport threads, one complete message at a time
public interface TransportListener {

    void onMessage(byte[] data, boolean binary);

    void onClosed(int code, String reason);

    void onError(Throwable error);
}
