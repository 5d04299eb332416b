package com.bbthechange.moments.client;

import com.bbthechange.moments.upload.media.MediaSource;

/**
 * Durable object storage for gallery media.
 */
public interface BlobStorageClient {

    /**
     * Store the source's bytes under the key.
     *
     * @return public URL of the stored object
     * @throws com.bbthechange.moments.exception.MediaTransferException if the object could not be stored
     */
    String upload(String key, MediaSource source, String contentType);

    String publicUrl(String key);

    String getBucket();

    void delete(String key);
}
