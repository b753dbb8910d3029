package com.umitunal.qworker.core;

/**
 * Snapshot of queue contents for monitoring.
 */
public class QueueMetrics {
    private final long highPriorityJobs;
    private final long defaultPriorityJobs;
    private final long lowPriorityJobs;
    private final long delayedJobs;
    private final long processingJobs;
    private final long failedJobs;

    public QueueMetrics(long highPriorityJobs, long defaultPriorityJobs, long lowPriorityJobs,
                        long delayedJobs, long processingJobs, long failedJobs) {
        this.highPriorityJobs = highPriorityJobs;
        this.defaultPriorityJobs = defaultPriorityJobs;
        this.lowPriorityJobs = lowPriorityJobs;
        this.delayedJobs = delayedJobs;
        this.processingJobs = processingJobs;
        this.failedJobs = failedJobs;
    }

    public long getHighPriorityJobs() { return highPriorityJobs; }
    public long getDefaultPriorityJobs() { return defaultPriorityJobs; }
    public long getLowPriorityJobs() { return lowPriorityJobs; }
    public long getDelayedJobs() { return delayedJobs; }
    public long getProcessingJobs() { return processingJobs; }
    public long getFailedJobs() { return failedJobs; }

    /**
     * Records that are ready to be popped right now, across all priorities.
     */
    public long getQueuedJobs() {
        return highPriorityJobs + defaultPriorityJobs + lowPriorityJobs;
    }

    public long getTotalJobs() {
        return getQueuedJobs() + delayedJobs + processingJobs + failedJobs;
    }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{high=%d, default=%d, low=%d, delayed=%d, processing=%d, failed=%d}",
            highPriorityJobs, defaultPriorityJobs, lowPriorityJobs, delayedJobs, processingJobs, failedJobs
        );
    }
}
