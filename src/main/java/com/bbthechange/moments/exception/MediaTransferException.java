package com.bbthechange.moments.exception;

/**
 * Moving bytes to durable storage failed. Retryable with backoff.
 */
public class MediaTransferException extends RuntimeException {

    public MediaTransferException(String message) {
        super(message);
    }

    public MediaTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
