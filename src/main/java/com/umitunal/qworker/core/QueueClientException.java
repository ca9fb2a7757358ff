package com.umitunal.qworker.core;

/**
 * Raised when the transport behind a {@link QueueClient} fails.
 */
public class QueueClientException extends RuntimeException {

    public QueueClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
