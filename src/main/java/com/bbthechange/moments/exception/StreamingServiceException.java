package com.bbthechange.moments.exception;

/**
 * Exception thrown when the streaming video service fails.
 * The error type decides whether the transport falls back to blob storage.
 */
public class StreamingServiceException extends MediaTransferException {

    private final ErrorType errorType;

    public enum ErrorType {
        /**
         * No upload session could be obtained. The caller falls back to blob storage.
         */
        SESSION_UNAVAILABLE,

        /**
         * A session exists but the chunked transfer could not be completed.
         */
        TRANSFER_FAILED
    }

    public StreamingServiceException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public StreamingServiceException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isSessionUnavailable() {
        return errorType == ErrorType.SESSION_UNAVAILABLE;
    }

    /**
     * Factory method for a failed session request.
     */
    public static StreamingServiceException sessionUnavailable(String message, Throwable cause) {
        return new StreamingServiceException(ErrorType.SESSION_UNAVAILABLE, message, cause);
    }

    /**
     * Factory method for a transfer that stopped after the session was created.
     */
    public static StreamingServiceException transferFailed(String message, Throwable cause) {
        return new StreamingServiceException(ErrorType.TRANSFER_FAILED, message, cause);
    }
}
