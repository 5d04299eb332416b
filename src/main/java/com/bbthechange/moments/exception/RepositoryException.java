package com.bbthechange.moments.exception;

/**
 * Exception thrown when record store operations fail.
 * Wraps lower-level DynamoDB exceptions with meaningful messages.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
