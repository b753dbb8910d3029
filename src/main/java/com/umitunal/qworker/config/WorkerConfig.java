package com.umitunal.qworker.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Run limits and polling settings for a worker.
 */
public class WorkerConfig {
    private final String workerId;
    private final int maxJobs;
    private final Duration maxTime;
    private final Duration sleep;
    private final long popTimeoutSeconds;

    private WorkerConfig(Builder builder) {
        this.workerId = builder.workerId;
        this.maxJobs = builder.maxJobs;
        this.maxTime = builder.maxTime;
        this.sleep = builder.sleep;
        this.popTimeoutSeconds = builder.popTimeoutSeconds;
    }

    public String getWorkerId() { return workerId; }

    /**
     * Completed jobs after which the worker stops; 0 means unlimited.
     */
    public int getMaxJobs() { return maxJobs; }

    /**
     * Wall-clock run time after which the worker stops; zero means unlimited.
     */
    public Duration getMaxTime() { return maxTime; }

    /**
     * Pause between polls when the queue is empty.
     */
    public Duration getSleep() { return sleep; }

    public long getPopTimeoutSeconds() { return popTimeoutSeconds; }

    public static Builder newBuilder(String workerId) {
        return new Builder(workerId);
    }

    @Override
    public String toString() {
        return String.format("WorkerConfig{workerId='%s', maxJobs=%s, maxTime=%s, sleep=%s, popTimeout=%ds}",
                workerId,
                maxJobs == 0 ? "unlimited" : maxJobs,
                maxTime.isZero() ? "unlimited" : maxTime.toSeconds() + "s",
                sleep,
                popTimeoutSeconds);
    }

    public static class Builder {
        private final String workerId;
        private int maxJobs = 0;
        private Duration maxTime = Duration.ZERO;
        private Duration sleep = Duration.ofSeconds(3);
        private long popTimeoutSeconds = 1;

        private Builder(String workerId) {
            this.workerId = Objects.requireNonNull(workerId, "workerId");
        }

        /**
         * Stop after this many completed jobs. Default: 0 (unlimited)
         */
        public Builder withMaxJobs(int maxJobs) {
            if (maxJobs < 0) {
                throw new IllegalArgumentException("maxJobs must be >= 0");
            }
            this.maxJobs = maxJobs;
            return this;
        }

        /**
         * Stop once this much time has elapsed. Default: zero (unlimited)
         */
        public Builder withMaxTime(Duration maxTime) {
            if (maxTime == null || maxTime.isNegative()) {
                throw new IllegalArgumentException("maxTime must be >= 0");
            }
            this.maxTime = maxTime;
            return this;
        }

        /**
         * Idle sleep when no job is available. Default: 3 seconds
         */
        public Builder withSleep(Duration sleep) {
            if (sleep == null || sleep.isNegative()) {
                throw new IllegalArgumentException("sleep must be >= 0");
            }
            this.sleep = sleep;
            return this;
        }

        /**
         * How long a pop may wait for a record. Default: 1 second
         */
        public Builder withPopTimeout(long seconds) {
            if (seconds < 0) {
                throw new IllegalArgumentException("popTimeout must be >= 0");
            }
            this.popTimeoutSeconds = seconds;
            return this;
        }

        public WorkerConfig build() {
            return new WorkerConfig(this);
        }
    }
}
