package com.umitunal.qworker.core;

import java.util.Objects;

/**
 * Outcome of a single {@link Job#handle()} call.
 */
public final class JobResult {

    /**
     * How the worker should resolve the record after this attempt.
     */
    public enum Kind {
        SUCCESS,     // Remove the record
        RETRYABLE,   // Retry while attempts remain
        TERMINAL     // Fail permanently, no further attempts
    }

    private static final JobResult SUCCESS = new JobResult(Kind.SUCCESS, null, null);

    private final Kind kind;
    private final String message;
    private final Throwable cause;

    private JobResult(Kind kind, String message, Throwable cause) {
        this.kind = kind;
        this.message = message;
        this.cause = cause;
    }

    public static JobResult success() {
        return SUCCESS;
    }

    public static JobResult retryable(String message) {
        return new JobResult(Kind.RETRYABLE, Objects.requireNonNull(message, "message"), null);
    }

    public static JobResult retryable(String message, Throwable cause) {
        return new JobResult(Kind.RETRYABLE, Objects.requireNonNull(message, "message"), cause);
    }

    public static JobResult retryable(Throwable cause) {
        return new JobResult(Kind.RETRYABLE, describe(cause), cause);
    }

    public static JobResult terminal(String message) {
        return new JobResult(Kind.TERMINAL, Objects.requireNonNull(message, "message"), null);
    }

    public static JobResult terminal(String message, Throwable cause) {
        return new JobResult(Kind.TERMINAL, Objects.requireNonNull(message, "message"), cause);
    }

    public Kind getKind() { return kind; }
    public String getMessage() { return message; }
    public Throwable getCause() { return cause; }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }

    @Override
    public String toString() {
        return kind == Kind.SUCCESS
                ? "JobResult{SUCCESS}"
                : String.format("JobResult{%s, message='%s'}", kind, message);
    }
}
