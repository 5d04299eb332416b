package com.bbthechange.moments.client;

import com.bbthechange.moments.upload.media.MediaSource;

/**
 * Managed streaming and transcoding service for videos.
 */
public interface StreamingVideoClient {

    /**
     * False when no streaming service is configured; videos then go to blob storage directly.
     */
    boolean isEnabled();

    /**
     * @throws com.bbthechange.moments.exception.StreamingServiceException with
     *         {@code SESSION_UNAVAILABLE} when no session could be obtained
     */
    StreamingUploadSession createSession(String name, String contentType, long sizeBytes);

    /**
     * Send the whole source in chunks, resuming from the server's offset after a failed chunk.
     *
     * @throws com.bbthechange.moments.exception.StreamingServiceException with
     *         {@code TRANSFER_FAILED} once chunk retries are exhausted
     */
    void transfer(StreamingUploadSession session, MediaSource source, ProgressListener listener);
}
