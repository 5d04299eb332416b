package com.bbthechange.moments.client;

import com.bbthechange.moments.config.StreamingProperties;
import com.bbthechange.moments.exception.StreamingServiceException;
import com.bbthechange.moments.upload.media.MediaSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Client for the streaming service's tus (resumable upload protocol 1.0.0) endpoint.
 * Creates an upload, then PATCHes the file in chunks; a failed chunk is resumed from the offset
 * the server reports.
 */
@Component
public class TusStreamingVideoClient implements StreamingVideoClient {

    private static final Logger logger = LoggerFactory.getLogger(TusStreamingVideoClient.class);

    static final String TUS_VERSION = "1.0.0";
    static final String MEDIA_ID_HEADER = "stream-media-id";
    private static final long[] CHUNK_RETRY_DELAYS_MS = {0, 1000, 3000};

    private final HttpClient httpClient;
    private final StreamingProperties properties;

    @Autowired
    public TusStreamingVideoClient(HttpClient mediaHttpClient, StreamingProperties properties) {
        this.httpClient = mediaHttpClient;
        this.properties = properties;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled()
                && properties.getBaseUrl() != null
                && !properties.getBaseUrl().isEmpty();
    }

    @Override
    public StreamingUploadSession createSession(String name, String contentType, long sizeBytes) {
        if (!isEnabled()) {
            throw StreamingServiceException.sessionUnavailable("Streaming service is not configured", null);
        }

        HttpRequest request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl()))
                .header("Tus-Resumable", TUS_VERSION)
                .header("Upload-Length", String.valueOf(sizeBytes))
                .header("Upload-Metadata", metadata(name, contentType))
                .timeout(properties.getRequestTimeout())
                .POST(HttpRequest.BodyPublishers.noBody()))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw StreamingServiceException.sessionUnavailable("Streaming service unreachable", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StreamingServiceException.sessionUnavailable("Interrupted while creating upload session", e);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            logger.warn("Streaming service refused upload session for {}: status {}", name, statusCode);
            throw StreamingServiceException.sessionUnavailable(
                    "Streaming service returned status " + statusCode, null);
        }

        String location = response.headers().firstValue("Location").orElse(null);
        if (location == null || location.isEmpty()) {
            throw StreamingServiceException.sessionUnavailable("Streaming service returned no upload URL", null);
        }
        String uploadUrl = URI.create(properties.getBaseUrl()).resolve(location).toString();
        String videoId = response.headers().firstValue(MEDIA_ID_HEADER).orElse(null);

        logger.info("Created streaming upload session for {} (video {})", name, videoId);
        return new StreamingUploadSession(uploadUrl, videoId);
    }

    @Override
    public void transfer(StreamingUploadSession session, MediaSource source, ProgressListener listener) {
        long total = source.getSizeBytes();
        long offset = 0;
        int failures = 0;

        while (offset < total) {
            try {
                offset = sendChunk(session, source, offset, total);
                listener.onProgress(percent(offset, total));
            } catch (IOException | ChunkRejectedException e) {
                if (failures >= CHUNK_RETRY_DELAYS_MS.length) {
                    throw StreamingServiceException.transferFailed(
                            "Chunked upload of " + source.getName() + " failed at offset " + offset, e);
                }
                long delayMs = CHUNK_RETRY_DELAYS_MS[failures++];
                logger.warn("Chunk of {} failed at offset {} (attempt {}/{}), resuming in {}ms: {}",
                        source.getName(), offset, failures, CHUNK_RETRY_DELAYS_MS.length, delayMs, e.getMessage());
                sleep(delayMs);
                offset = resumeOffset(session, offset);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw StreamingServiceException.transferFailed("Interrupted during chunked upload", e);
            }
        }
        logger.info("Streamed {} ({} bytes) to video {}", source.getName(), total, session.videoId());
    }

    private long sendChunk(StreamingUploadSession session, MediaSource source, long offset, long total)
            throws IOException, InterruptedException {
        int length = (int) Math.min(properties.getChunkSize().toBytes(), total - offset);
        byte[] chunk;
        try (InputStream in = source.openStream()) {
            in.skipNBytes(offset);
            chunk = in.readNBytes(length);
        }

        HttpRequest request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(session.uploadUrl()))
                .header("Tus-Resumable", TUS_VERSION)
                .header("Upload-Offset", String.valueOf(offset))
                .header("Content-Type", "application/offset+octet-stream")
                .timeout(properties.getRequestTimeout())
                .method("PATCH", HttpRequest.BodyPublishers.ofByteArray(chunk)))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            throw new ChunkRejectedException("PATCH returned status " + statusCode);
        }
        return response.headers().firstValue("Upload-Offset")
                .map(Long::parseLong)
                .orElse(offset + chunk.length);
    }

    /**
     * Ask the server how many bytes it holds. Falls back to the last known offset when the
     * server cannot be asked; the next chunk attempt then fails or succeeds on its own.
     */
    private long resumeOffset(StreamingUploadSession session, long lastKnown) {
        HttpRequest request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(session.uploadUrl()))
                .header("Tus-Resumable", TUS_VERSION)
                .timeout(properties.getRequestTimeout())
                .method("HEAD", HttpRequest.BodyPublishers.noBody()))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                logger.warn("HEAD on {} returned status {}", session.uploadUrl(), response.statusCode());
                return lastKnown;
            }
            return response.headers().firstValue("Upload-Offset").map(Long::parseLong).orElse(lastKnown);
        } catch (IOException e) {
            logger.warn("Could not read upload offset of {}: {}", session.uploadUrl(), e.getMessage());
            return lastKnown;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StreamingServiceException.transferFailed("Interrupted while reading upload offset", e);
        }
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        String token = properties.getApiToken();
        if (token != null && !token.isEmpty()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    static String metadata(String name, String contentType) {
        Base64.Encoder encoder = Base64.getEncoder();
        return "name " + encoder.encodeToString(name.getBytes(StandardCharsets.UTF_8))
                + ",filetype " + encoder.encodeToString(contentType.getBytes(StandardCharsets.UTF_8));
    }

    private static int percent(long offset, long total) {
        return total == 0 ? 100 : (int) Math.min(100, offset * 100 / total);
    }

    /**
     * Sleep for the specified duration.
     * Package-private for testing.
     */
    void sleep(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    /**
     * The server answered a chunk with a non-success status.
     */
    private static class ChunkRejectedException extends RuntimeException {
        ChunkRejectedException(String message) {
            super(message);
        }
    }
}
