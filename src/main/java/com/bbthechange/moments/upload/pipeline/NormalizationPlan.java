package com.bbthechange.moments.upload.pipeline;

/**
 * How a file's format is brought into something the gallery can serve.
 */
public enum NormalizationPlan {
    /** Uploaded in its own format. */
    NONE,
    /** Decoded and re-encoded as JPEG before upload. */
    CLIENT_CONVERT,
    /** Uploaded as-is, then converted by the platform's conversion endpoint. */
    SERVER_CONVERT
}
