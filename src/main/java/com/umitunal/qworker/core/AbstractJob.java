package com.umitunal.qworker.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for jobs: payload storage, required-field validation, retry
 * policy and the default permanent-failure hook.
 *
 * <p>The payload is normalized to the values it reads back as from JSON, so a
 * stored and rebuilt job compare equal.
 *
 * <p>Subclasses declare their required payload fields in the constructor call;
 * a missing field fails construction with {@link JobValidationException}, so
 * an invalid job can never be enqueued.
 */
public abstract class AbstractJob implements Job {
    private static final Logger log = LoggerFactory.getLogger(AbstractJob.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_DELAY = 60; // seconds

    private final Map<String, Object> payload;
    private int attempts;
    private int maxAttempts;
    private long retryDelay;

    protected AbstractJob(Map<String, Object> payload, String... requiredFields) {
        this(payload, DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY, requiredFields);
    }

    protected AbstractJob(Map<String, Object> payload, int maxAttempts, long retryDelay,
                          String... requiredFields) {
        Map<String, Object> copy = Payloads.normalize(getName(), payload);
        this.payload = copy;
        setMaxAttempts(maxAttempts);
        setRetryDelay(retryDelay);

        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (isBlank(copy.get(field))) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new JobValidationException(getName() + " requires " + String.join(", ", missing) + " in payload");
        }
    }

    @Override
    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public int getAttempts() {
        return attempts;
    }

    @Override
    public void setAttempts(int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0");
        }
        this.attempts = attempts;
    }

    @Override
    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public void setMaxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public long getRetryDelay() {
        return retryDelay;
    }

    @Override
    public void setRetryDelay(long retryDelaySeconds) {
        if (retryDelaySeconds < 0) {
            throw new IllegalArgumentException("retryDelay must be >= 0");
        }
        this.retryDelay = retryDelaySeconds;
    }

    /**
     * Logs the permanent failure. Subclasses adding side effects should call
     * through to this method first.
     */
    @Override
    public void failed(JobExecutionException error) {
        log.error("Job failed permanently: job={}, payload={}, attempts={}, error={}",
                getName(), payload, attempts, error.getMessage());
    }

    protected String getString(String field) {
        Object value = payload.get(field);
        return value != null ? value.toString() : null;
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String && ((String) value).isBlank());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AbstractJob other = (AbstractJob) o;
        return attempts == other.attempts
                && maxAttempts == other.maxAttempts
                && retryDelay == other.retryDelay
                && getName().equals(other.getName())
                && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getName(), payload, attempts, maxAttempts, retryDelay);
    }

    @Override
    public String toString() {
        return String.format("%s{attempt=%d/%d, retryDelay=%ds, payload=%s}",
                getName(), attempts, maxAttempts, retryDelay, payload);
    }
}
