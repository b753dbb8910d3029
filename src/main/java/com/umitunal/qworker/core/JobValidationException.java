package com.umitunal.qworker.core;

/**
 * Thrown when a job is constructed with a malformed payload.
 * Such a job never reaches the store.
 */
public class JobValidationException extends IllegalArgumentException {
    public JobValidationException(String message) {
        super(message);
    }
}
