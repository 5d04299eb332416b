package com.bbthechange.moments.upload.media;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Media backed by a file on local disk. Temporary files (multipart intake) are deleted on
 * {@link #release()}.
 */
public class FileMediaSource implements MediaSource {

    private static final Logger logger = LoggerFactory.getLogger(FileMediaSource.class);

    private final Path path;
    private final String name;
    private final String contentType;
    private final long sizeBytes;
    private final boolean temporary;

    public FileMediaSource(Path path, String name, String contentType, boolean temporary) {
        this.path = path;
        this.name = name;
        this.contentType = contentType != null ? contentType : "";
        this.temporary = temporary;
        try {
            this.sizeBytes = Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + path, e);
        }
    }

    public static FileMediaSource of(Path path, String contentType) {
        return new FileMediaSource(path, path.getFileName().toString(), contentType, false);
    }

    public Path getPath() {
        return path;
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
        return sizeBytes;
    }

    @Override
    public InputStream openStream() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public void release() {
        if (!temporary) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Failed to delete temporary media file {}: {}", path, e.getMessage());
        }
    }
}
