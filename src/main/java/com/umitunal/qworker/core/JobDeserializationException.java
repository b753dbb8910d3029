package com.umitunal.qworker.core;

/**
 * Thrown when a stored record cannot be turned back into a job: corrupt data,
 * an unknown job name or a payload the job type rejects. Always terminal.
 */
public class JobDeserializationException extends RuntimeException {
    public JobDeserializationException(String message) {
        super(message);
    }

    public JobDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
