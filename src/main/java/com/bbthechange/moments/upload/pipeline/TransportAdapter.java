package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.client.BlobStorageClient;
import com.bbthechange.moments.client.ProgressListener;
import com.bbthechange.moments.client.ServerConversionClient;
import com.bbthechange.moments.client.StreamingUploadSession;
import com.bbthechange.moments.client.StreamingVideoClient;
import com.bbthechange.moments.exception.MediaTransferException;
import com.bbthechange.moments.exception.StreamingServiceException;
import com.bbthechange.moments.upload.media.MediaSource;
import com.bbthechange.moments.upload.media.MediaTypes;
import com.bbthechange.moments.upload.state.MediaKind;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Moves a file's bytes to durable storage.
 *
 * <p>Photos go to blob storage in one call, followed by a server-side conversion when the format
 * could not be converted locally. Videos go to the streaming service; when no session can be
 * obtained the same attempt falls back to blob storage. A video thumbnail is uploaded to blob
 * storage either way, and its failure never fails the file.
 */
@Component
public class TransportAdapter {

    private static final Logger logger = LoggerFactory.getLogger(TransportAdapter.class);

    static final String TRANSCODE_PROCESSING = "processing";

    private final BlobStorageClient blobStorageClient;
    private final StreamingVideoClient streamingVideoClient;
    private final ServerConversionClient serverConversionClient;
    private final VideoThumbnailGenerator thumbnailGenerator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public TransportAdapter(BlobStorageClient blobStorageClient,
                            StreamingVideoClient streamingVideoClient,
                            ServerConversionClient serverConversionClient,
                            VideoThumbnailGenerator thumbnailGenerator,
                            MeterRegistry meterRegistry) {
        this(blobStorageClient, streamingVideoClient, serverConversionClient, thumbnailGenerator,
                meterRegistry, Clock.systemUTC());
    }

    TransportAdapter(BlobStorageClient blobStorageClient,
                     StreamingVideoClient streamingVideoClient,
                     ServerConversionClient serverConversionClient,
                     VideoThumbnailGenerator thumbnailGenerator,
                     MeterRegistry meterRegistry,
                     Clock clock) {
        this.blobStorageClient = blobStorageClient;
        this.streamingVideoClient = streamingVideoClient;
        this.serverConversionClient = serverConversionClient;
        this.thumbnailGenerator = thumbnailGenerator;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Blocking. Runs off the batch's mailbox.
     *
     * @throws MediaTransferException when the bytes could not be stored; the caller may retry
     */
    public TransferResult transfer(TransferRequest request, ProgressListener progress) {
        if (request.mediaKind() == MediaKind.VIDEO) {
            return transferVideo(request, progress);
        }
        return transferPhoto(request, progress);
    }

    private TransferResult transferPhoto(TransferRequest request, ProgressListener progress) {
        MediaSource source = request.source();
        String key = storageKey(request, extensionOf(source));
        String url = blobStorageClient.upload(key, source, MediaTypes.effectiveContentType(source));
        progress.onProgress(100);

        if (request.serverConversionRequired()) {
            try {
                url = serverConversionClient.convert(blobStorageClient.getBucket(), key);
            } catch (MediaTransferException e) {
                deleteQuietly(key);
                throw e;
            }
        }
        return new TransferResult(url, null, key, null, null, null);
    }

    private TransferResult transferVideo(TransferRequest request, ProgressListener progress) {
        MediaSource source = request.source();
        StoredThumbnail thumbnail = uploadThumbnail(request);
        try {
            if (streamingVideoClient.isEnabled()) {
                try {
                    StreamingUploadSession session = streamingVideoClient.createSession(
                            source.getName(), MediaTypes.effectiveContentType(source), source.getSizeBytes());
                    streamingVideoClient.transfer(session, source, progress);
                    return new TransferResult(null, thumbnail.url(), null, thumbnail.key(),
                            session.videoId(), TRANSCODE_PROCESSING);
                } catch (StreamingServiceException e) {
                    if (!e.isSessionUnavailable()) {
                        throw e;
                    }
                    meterRegistry.counter("moments.upload.video.fallback").increment();
                    logger.warn("No streaming session for {}, falling back to blob storage: {}",
                            source.getName(), e.getMessage());
                }
            }

            String key = storageKey(request, extensionOf(source));
            String url = blobStorageClient.upload(key, source, MediaTypes.effectiveContentType(source));
            progress.onProgress(100);
            return new TransferResult(url, thumbnail.url(), key, thumbnail.key(), null, null);
        } catch (RuntimeException e) {
            // a retry uploads a fresh thumbnail
            deleteQuietly(thumbnail.key());
            throw e;
        }
    }

    private StoredThumbnail uploadThumbnail(TransferRequest request) {
        Optional<MediaSource> thumbnail = Optional.empty();
        try {
            thumbnail = thumbnailGenerator.generate(request.source());
            if (thumbnail.isEmpty()) {
                return StoredThumbnail.NONE;
            }
            String key = storageKey(request, "jpg").replace(".jpg", "_thumb.jpg");
            return new StoredThumbnail(blobStorageClient.upload(key, thumbnail.get(), "image/jpeg"), key);
        } catch (RuntimeException e) {
            logger.warn("Thumbnail upload for {} failed, continuing without: {}",
                    request.source().getName(), e.getMessage());
            return StoredThumbnail.NONE;
        } finally {
            thumbnail.ifPresent(MediaSource::release);
        }
    }

    private record StoredThumbnail(String url, String key) {
        static final StoredThumbnail NONE = new StoredThumbnail(null, null);
    }

    /**
     * Best-effort removal of a stored object that no draft will reference.
     */
    public void deleteQuietly(String key) {
        if (key == null) {
            return;
        }
        try {
            blobStorageClient.delete(key);
        } catch (RuntimeException e) {
            logger.warn("Could not delete orphaned object {}: {}", key, e.getMessage());
        }
    }

    String storageKey(TransferRequest request, String extension) {
        String fileId = request.fileId();
        String shortId = fileId.length() > 8 ? fileId.substring(0, 8) : fileId;
        return request.eventId() + "/" + request.userId() + "/" + clock.millis() + "_" + shortId + "." + extension;
    }

    private static String extensionOf(MediaSource source) {
        String extension = MediaTypes.extension(source.getName());
        if (!extension.isEmpty()) {
            return extension;
        }
        String type = MediaTypes.effectiveContentType(source);
        int slash = type.indexOf('/');
        return slash >= 0 ? type.substring(slash + 1) : "bin";
    }
}
