package com.github.anirbanmu.shardline.gateway;

import java.util.HashMap;
import java.util.Map;

// websocket close codes the gateway uses, and what each one means for the session
public enum CloseCode {
    NORMAL(1000, CloseKind.RESUMABLE),
    GOING_AWAY(1001, CloseKind.RESUMABLE),
    UNKNOWN_ERROR(4000, CloseKind.RESUMABLE),
    UNKNOWN_OPCODE(4001, CloseKind.RESUMABLE),
    DECODE_ERROR(4002, CloseKind.RESUMABLE),
    NOT_AUTHENTICATED(4003, CloseKind.RESUMABLE),
    AUTHENTICATION_FAILED(4004, CloseKind.FATAL),
    ALREADY_AUTHENTICATED(4005, CloseKind.RESUMABLE),
    INVALID_SEQUENCE(4007, CloseKind.NON_RESUMABLE),
    RATE_LIMITED(4008, CloseKind.NON_RESUMABLE),
    SESSION_TIMED_OUT(4009, CloseKind.NON_RESUMABLE),
    INVALID_SHARD(4010, CloseKind.FATAL),
    SHARDING_REQUIRED(4011, CloseKind.FATAL),
    INVALID_API_VERSION(4012, CloseKind.FATAL),
    INVALID_INTENTS(4013, CloseKind.FATAL),
    DISALLOWED_INTENTS(4014, CloseKind.FATAL);

    private static final Map<Integer, CloseCode> BY_CODE = new HashMap<>();

    static {
        for (CloseCode c : values()) {
            BY_CODE.put(c.code, c);
        }
    }

    private final int code;
    private final CloseKind kind;

    CloseCode(int code, CloseKind kind) {
        this.code = code;
        this.kind = kind;
    }

    public int code() {
        return code;
    }

    public CloseKind kind() {
        return kind;
    }

    // null for codes we don't know about
    public static CloseCode of(int code) {
        return BY_CODE.get(code);
    }

    // unknown codes are treated as transient
    public static CloseKind classify(int code) {
        CloseCode known = BY_CODE.get(code);
        return known == null ? CloseKind.RESUMABLE : known.kind;
    }
}
