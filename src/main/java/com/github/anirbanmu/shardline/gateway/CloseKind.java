package com.github.anirbanmu.shardline.gateway;

// what a dead connection means for the session
public enum CloseKind {
    // reconnect and resume, session kept
    RESUMABLE,
    // reconnect and identify again, session dropped
    NON_RESUMABLE,
    // stop for good
    FATAL
}
