package com.bbthechange.moments.upload.media;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Media held in memory, produced by conversion, compression or thumbnail generation.
 */
public class InMemoryMediaSource implements MediaSource {

    private final String name;
    private final String contentType;
    private final byte[] bytes;

    public InMemoryMediaSource(String name, String contentType, byte[] bytes) {
        this.name = name;
        this.contentType = contentType;
        this.bytes = bytes;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getContentType() {
        return contentType;
    }

    @Override
    public long getSizeBytes() {
        return bytes.length;
    }

    @Override
    public InputStream openStream() throws IOException {
        return new ByteArrayInputStream(bytes);
    }
}
