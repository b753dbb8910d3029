package com.umitunal.qworker.core;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of serialized job records.
 *
 * <p>The store is the only shared resource between workers. Implementations
 * must guarantee that a record is handed out by {@link #pop(long)} to at most
 * one caller until that caller completes, retries or fails it.
 *
 * <p>Storage-engine failures surface as {@link QueueStoreException}.
 */
public interface QueueStore extends AutoCloseable {

    /**
     * Enqueue a serialized job.
     *
     * @param serializedJob the encoded job
     * @param priority queue priority
     * @param delaySeconds seconds before the record becomes available (0 = now)
     * @return the generated record id
     */
    String push(byte[] serializedJob, Priority priority, long delaySeconds);

    /**
     * Claim the next available record.
     *
     * @param timeoutSeconds how long to wait for a record to become available (0 = do not wait)
     * @return the claimed record, or empty if none became available in time
     */
    Optional<QueuedJob> pop(long timeoutSeconds);

    /**
     * Remove a record. Unknown ids are ignored.
     */
    void complete(String id);

    /**
     * Re-enqueue a record under the same id, available again after the delay.
     *
     * @param id the record id
     * @param serializedJob the job with its updated attempt count
     * @param delaySeconds seconds before the record becomes available again
     */
    void retry(String id, byte[] serializedJob, long delaySeconds);

    /**
     * Move a record to the terminal failed state. Failed records are never popped.
     *
     * @param id the record id
     * @param serializedJob the job as last seen by the worker
     * @param reason human-readable diagnostic
     */
    void fail(String id, byte[] serializedJob, String reason);

    /**
     * List records in the terminal failed state.
     */
    List<FailedRecord> failedRecords();

    /**
     * Delete all failed records.
     *
     * @return number of records removed
     */
    long purgeFailed();

    /**
     * Return records claimed longer ago than the threshold to the queue.
     * Meant for recovery after a worker crash.
     *
     * @return number of records recovered
     */
    long recoverAbandoned(long olderThanSeconds);

    /**
     * Get statistics about the queue.
     */
    QueueMetrics getMetrics();

    /**
     * Remove every record, in any state.
     */
    void clear();

    @Override
    void close();
}
