package com.bbthechange.moments.exception;

/**
 * Client-side format conversion failed. Retrying a corrupt or unsupported file is futile, so
 * the file goes straight to error.
 */
public class MediaConversionException extends RuntimeException {

    public MediaConversionException(String message) {
        super(message);
    }

    public MediaConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
