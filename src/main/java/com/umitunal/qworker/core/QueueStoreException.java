package com.umitunal.qworker.core;

/**
 * Unchecked exception wrapping storage-engine errors raised by a {@link QueueStore}.
 */
public class QueueStoreException extends RuntimeException {
    public QueueStoreException(String message) {
        super(message);
    }

    public QueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
