package com.umitunal.qworker.core;

import java.time.Instant;

/**
 * A record in the terminal failed state, kept for operator inspection.
 */
public final class FailedRecord {
    private final String id;
    private final byte[] serializedJob;
    private final String reason;
    private final Instant failedAt;

    public FailedRecord(String id, byte[] serializedJob, String reason, Instant failedAt) {
        this.id = id;
        this.serializedJob = serializedJob;
        this.reason = reason;
        this.failedAt = failedAt;
    }

    public String getId() { return id; }
    public byte[] getSerializedJob() { return serializedJob; }
    public String getReason() { return reason; }
    public Instant getFailedAt() { return failedAt; }

    @Override
    public String toString() {
        return String.format("FailedRecord{id='%s', reason='%s', failedAt=%s}", id, reason, failedAt);
    }
}
