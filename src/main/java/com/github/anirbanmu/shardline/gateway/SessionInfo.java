package com.github.anirbanmu.shardline.gateway;

// what a shard needs to resume. lastSequence is null until the first sequenced dispatch.
public record SessionInfo(String sessionId, Integer lastSequence, String resumeUrl) {

    public SessionInfo withSequence(Integer sequence) {
        return new SessionInfo(sessionId, sequence, resumeUrl);
    }

    public String redactedId() {
        return sessionId.length() > 4
            ? "..." + sessionId.substring(sessionId.length() - 4)
            : "REDACTED";
    }
}
