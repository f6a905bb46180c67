package com.github.anirbanmu.shardline.gateway;

public enum ConnectionState {
    NO_SESSION,
    CONNECTING,
    IDENTIFYING,
    RESUMING,
    // the only state that accepts application commands
    READY,
    RECONNECTING,
    // terminal
    STOPPED
}
