package com.bbthechange.moments.exception;

public class BatchNotFoundException extends RuntimeException {

    public BatchNotFoundException(String sessionId) {
        super("Upload batch not found: " + sessionId);
    }
}
