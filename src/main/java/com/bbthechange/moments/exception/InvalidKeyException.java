package com.bbthechange.moments.exception;

/**
 * Thrown when an identifier does not have the shape a table key requires.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
