package com.umitunal.qworker.core;

/**
 * Failure of a single execution attempt, as handed to {@link Job#failed}.
 */
public class JobExecutionException extends RuntimeException {
    private final String jobName;
    private final int attempt;
    private final boolean terminal;

    public JobExecutionException(String jobName, int attempt, String message, Throwable cause, boolean terminal) {
        super(message, cause);
        this.jobName = jobName;
        this.attempt = attempt;
        this.terminal = terminal;
    }

    /**
     * Build the exception describing a failed {@link JobResult}.
     */
    public static JobExecutionException from(Job job, JobResult result) {
        return new JobExecutionException(job.getName(), job.getAttempts(), result.getMessage(),
                result.getCause(), result.getKind() == JobResult.Kind.TERMINAL);
    }

    public String getJobName() { return jobName; }
    public int getAttempt() { return attempt; }

    /**
     * Whether the job declared this failure non-retryable.
     */
    public boolean isTerminal() { return terminal; }
}
