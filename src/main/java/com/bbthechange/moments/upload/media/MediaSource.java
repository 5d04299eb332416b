package com.bbthechange.moments.upload.media;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opaque handle to the raw bytes of one media file. The batch state keeps the handle, never
 * the bytes; every consumer opens its own stream.
 */
public interface MediaSource {

    String getName();

    /**
     * Declared MIME type, possibly empty when the client did not send one.
     */
    String getContentType();

    long getSizeBytes();

    InputStream openStream() throws IOException;

    /**
     * Release any resource backing this source once its file has left the batch.
     */
    default void release() {
    }
}
