package com.bbthechange.moments.exception;

/**
 * Recording a draft for stored bytes failed. The stored object stays in place until the file is
 * retried or discarded.
 */
public class DraftSaveException extends RuntimeException {

    public DraftSaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
