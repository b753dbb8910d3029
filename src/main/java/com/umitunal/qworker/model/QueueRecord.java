package com.umitunal.qworker.model;

import com.umitunal.qworker.core.FailedRecord;
import com.umitunal.qworker.core.Priority;
import com.umitunal.qworker.core.QueuedJob;

import java.time.Instant;
import java.util.Comparator;

/**
 * A job record as held by a queue store.
 */
public class QueueRecord {

    /**
     * Pop order: priority, then availability time, then enqueue order.
     */
    public static final Comparator<QueueRecord> POP_ORDER = Comparator
            .comparing(QueueRecord::getPriority)
            .thenComparingLong(QueueRecord::getAvailableAt)
            .thenComparingLong(QueueRecord::getSequence);

    private final String id;
    private final Priority priority;
    private final long sequence;
    private final long queuedAt;

    private byte[] serializedJob;
    private RecordStatus status;
    private long availableAt;
    private long claimedAt;
    private long failedAt;
    private String failureReason;
    private long version;  // For optimistic locking

    public QueueRecord(String id, byte[] serializedJob, Priority priority, long sequence,
                       long queuedAt, long availableAt) {
        this.id = id;
        this.serializedJob = serializedJob;
        this.priority = priority;
        this.sequence = sequence;
        this.queuedAt = queuedAt;
        this.availableAt = availableAt;
        this.status = RecordStatus.QUEUED;
    }

    public String getId() { return id; }
    public byte[] getSerializedJob() { return serializedJob; }
    public Priority getPriority() { return priority; }
    public long getSequence() { return sequence; }
    public long getQueuedAt() { return queuedAt; }
    public RecordStatus getStatus() { return status; }
    public long getAvailableAt() { return availableAt; }
    public long getClaimedAt() { return claimedAt; }
    public long getFailedAt() { return failedAt; }
    public String getFailureReason() { return failureReason; }
    public long getVersion() { return version; }

    // Package-private setters for deserialization
    void setStatus(RecordStatus status) { this.status = status; }
    void setClaimedAt(long claimedAt) { this.claimedAt = claimedAt; }
    void setFailedAt(long failedAt) { this.failedAt = failedAt; }
    void setFailureReason(String failureReason) { this.failureReason = failureReason; }
    void setVersion(long version) { this.version = version; }

    public boolean isReady(long now) {
        return status == RecordStatus.QUEUED && availableAt <= now;
    }

    public boolean isDelayed(long now) {
        return status == RecordStatus.QUEUED && availableAt > now;
    }

    public boolean isAbandoned(long now, long thresholdMs) {
        return status == RecordStatus.PROCESSING && now - claimedAt > thresholdMs;
    }

    public void claim(long now) {
        this.status = RecordStatus.PROCESSING;
        this.claimedAt = now;
        this.version++;
    }

    public void requeue(byte[] serializedJob, long availableAt) {
        this.serializedJob = serializedJob;
        this.status = RecordStatus.QUEUED;
        this.availableAt = availableAt;
        this.claimedAt = 0;
        this.version++;
    }

    public void markFailed(byte[] serializedJob, String reason, long now) {
        this.serializedJob = serializedJob;
        this.status = RecordStatus.FAILED;
        this.failureReason = reason;
        this.failedAt = now;
        this.claimedAt = 0;
        this.version++;
    }

    public QueuedJob toQueuedJob() {
        return new QueuedJob(id, serializedJob, priority);
    }

    public FailedRecord toFailedRecord() {
        return new FailedRecord(id, serializedJob, failureReason, Instant.ofEpochMilli(failedAt));
    }

    @Override
    public String toString() {
        return String.format("QueueRecord{id='%s', status=%s, priority=%s, availableAt=%d, version=%d}",
                id, status, priority, availableAt, version);
    }
}
