package com.bbthechange.moments.exception;

/**
 * Thrown when no caller identity is present, or the caller does not own the batch it addresses.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
