package com.bbthechange.moments.exception;

/**
 * A file was rejected for its type or size. Never retried.
 */
public class MediaValidationException extends RuntimeException {

    public MediaValidationException(String message) {
        super(message);
    }
}
