package com.umitunal.qworker.core;

import java.util.Map;

/**
 * A unit of deferred work: a named payload plus its retry policy.
 *
 * <p>Jobs are serialized into a {@link QueueStore}, claimed by a worker and
 * executed through {@link #handle()}. The worker owns the attempt counter;
 * a job only reports its outcome.
 */
public interface Job {

    /**
     * Gets the job type name, used to find the factory on deserialization.
     */
    String getName();

    /**
     * Gets the job payload (read-only view).
     */
    Map<String, Object> getPayload();

    /**
     * Gets the number of execution attempts made so far.
     */
    int getAttempts();

    /**
     * Sets the number of execution attempts made so far.
     */
    void setAttempts(int attempts);

    /**
     * Gets the maximum number of execution attempts allowed.
     */
    int getMaxAttempts();

    void setMaxAttempts(int maxAttempts);

    /**
     * Gets the delay, in seconds, before a failed attempt becomes eligible again.
     */
    long getRetryDelay();

    void setRetryDelay(long retryDelaySeconds);

    /**
     * Execute the job.
     *
     * <p>Implementations report failures through the returned {@link JobResult}
     * rather than swallowing them, so the worker can apply its retry policy.
     * An exception escaping this method is treated as a retryable failure.
     *
     * @return the outcome of this attempt, never null
     */
    JobResult handle();

    /**
     * Called once, after the final attempt has failed.
     *
     * @param error the failure of the last attempt
     */
    void failed(JobExecutionException error);
}
