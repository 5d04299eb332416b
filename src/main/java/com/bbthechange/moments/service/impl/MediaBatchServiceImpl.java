package com.bbthechange.moments.service.impl;

import com.bbthechange.moments.dto.AddFilesResponse;
import com.bbthechange.moments.dto.BatchSnapshotResponse;
import com.bbthechange.moments.dto.PublishResponse;
import com.bbthechange.moments.exception.BatchNotFoundException;
import com.bbthechange.moments.exception.MediaValidationException;
import com.bbthechange.moments.service.MediaBatchService;
import com.bbthechange.moments.upload.MediaUploadOrchestrator;
import com.bbthechange.moments.upload.MediaUploadOrchestratorFactory;
import com.bbthechange.moments.upload.media.FileMediaSource;
import com.bbthechange.moments.upload.media.MediaSource;
import com.bbthechange.moments.upload.state.BatchUploadState;
import com.bbthechange.moments.util.MomentsKeyFactory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

@Service
@Slf4j
public class MediaBatchServiceImpl implements MediaBatchService {

    private static final long OPERATION_TIMEOUT_SECONDS = 30;
    private static final long PUBLISH_TIMEOUT_SECONDS = 120;
    private static final Pattern SAFE_SUFFIX = Pattern.compile("\\.[A-Za-z0-9]{1,10}");

    private final MediaUploadOrchestratorFactory orchestratorFactory;
    private final Map<String, MediaUploadOrchestrator> sessions = new ConcurrentHashMap<>();

    public MediaBatchServiceImpl(MediaUploadOrchestratorFactory orchestratorFactory) {
        this.orchestratorFactory = orchestratorFactory;
    }

    @Override
    public BatchSnapshotResponse openBatch(String eventId, String userId) {
        MomentsKeyFactory.validateEventId(eventId);
        String sessionId = UUID.randomUUID().toString();
        MediaUploadOrchestrator orchestrator = orchestratorFactory.create(eventId, userId);
        sessions.put(sessionId, orchestrator);
        log.info("User {} opened upload session {} for event {}", userId, sessionId, eventId);
        return BatchSnapshotResponse.from(sessionId, orchestrator.getState());
    }

    @Override
    public BatchSnapshotResponse getBatch(String sessionId, String userId) {
        return BatchSnapshotResponse.from(sessionId, ownedBatch(sessionId, userId).getState());
    }

    @Override
    public AddFilesResponse addFiles(String sessionId, String userId, List<MultipartFile> files) {
        MediaUploadOrchestrator orchestrator = ownedBatch(sessionId, userId);
        if (files == null || files.isEmpty()) {
            throw new MediaValidationException("No files provided");
        }

        List<MediaSource> sources = new ArrayList<>();
        try {
            for (MultipartFile file : files) {
                sources.add(toMediaSource(file));
            }
        } catch (IOException e) {
            sources.forEach(MediaSource::release);
            throw new MediaValidationException("Could not read uploaded file: " + e.getMessage());
        }

        List<String> fileIds = await(orchestrator.addFiles(sources), OPERATION_TIMEOUT_SECONDS);
        return new AddFilesResponse(fileIds, BatchSnapshotResponse.from(sessionId, orchestrator.getState()));
    }

    @Override
    public BatchSnapshotResponse removeFile(String sessionId, String userId, String fileId) {
        MediaUploadOrchestrator orchestrator = ownedBatch(sessionId, userId);
        if (!await(orchestrator.removeFile(fileId), OPERATION_TIMEOUT_SECONDS)) {
            log.debug("File {} not present in session {}", fileId, sessionId);
        }
        return BatchSnapshotResponse.from(sessionId, orchestrator.getState());
    }

    @Override
    public BatchSnapshotResponse start(String sessionId, String userId) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).start());
    }

    @Override
    public BatchSnapshotResponse pause(String sessionId, String userId) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).pause());
    }

    @Override
    public BatchSnapshotResponse resume(String sessionId, String userId) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).resume());
    }

    @Override
    public BatchSnapshotResponse retryFile(String sessionId, String userId, String fileId) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).retryFile(fileId));
    }

    @Override
    public BatchSnapshotResponse retryAllFailed(String sessionId, String userId) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).retryAllFailed());
    }

    @Override
    public BatchSnapshotResponse setCaption(String sessionId, String userId, String fileId, String caption) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).setCaption(fileId, caption));
    }

    @Override
    public BatchSnapshotResponse setBatchCaption(String sessionId, String userId, List<String> fileIds, String caption) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).setBatchCaption(fileIds, caption));
    }

    @Override
    public BatchSnapshotResponse clearComplete(String sessionId, String userId) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).clearComplete());
    }

    @Override
    public BatchSnapshotResponse reset(String sessionId, String userId) {
        return snapshot(sessionId, ownedBatch(sessionId, userId).reset());
    }

    @Override
    public PublishResponse publishBatch(String sessionId, String userId) {
        MediaUploadOrchestrator orchestrator = ownedBatch(sessionId, userId);
        int published = await(orchestrator.publish(), PUBLISH_TIMEOUT_SECONDS);
        return new PublishResponse(orchestrator.getState().getEventId(), published);
    }

    @Override
    public PublishResponse publishEvent(String eventId, String userId) {
        MomentsKeyFactory.validateEventId(eventId);
        int published = orchestratorFactory.getPublishCoordinator().publish(eventId, userId);
        return new PublishResponse(eventId, published);
    }

    @Override
    public void discard(String sessionId, String userId) {
        MediaUploadOrchestrator orchestrator = ownedBatch(sessionId, userId);
        sessions.remove(sessionId, orchestrator);
        await(orchestrator.close(), OPERATION_TIMEOUT_SECONDS);
        log.info("User {} discarded upload session {}", userId, sessionId);
    }

    int sessionCount() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        if (!sessions.isEmpty()) {
            log.info("Closing {} open upload sessions", sessions.size());
        }
        sessions.values().forEach(MediaUploadOrchestrator::close);
        sessions.clear();
    }

    private MediaUploadOrchestrator ownedBatch(String sessionId, String userId) {
        MediaUploadOrchestrator orchestrator = sessions.get(sessionId);
        if (orchestrator == null || !orchestrator.getState().getUserId().equals(userId)) {
            throw new BatchNotFoundException(sessionId);
        }
        return orchestrator;
    }

    private MediaSource toMediaSource(MultipartFile file) throws IOException {
        String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        Path path = Files.createTempFile("moment-", suffixOf(name));
        file.transferTo(path);
        return new FileMediaSource(path, name, file.getContentType(), true);
    }

    private static String suffixOf(String name) {
        int dot = name.lastIndexOf('.');
        String suffix = dot >= 0 ? name.substring(dot) : "";
        return SAFE_SUFFIX.matcher(suffix).matches() ? suffix : ".bin";
    }

    private BatchSnapshotResponse snapshot(String sessionId, CompletableFuture<BatchUploadState> future) {
        return BatchSnapshotResponse.from(sessionId, await(future, OPERATION_TIMEOUT_SECONDS));
    }

    private <T> T await(CompletableFuture<T> future, long timeoutSeconds) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for upload batch", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Upload batch operation failed", e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Upload batch did not respond in time", e);
        }
    }
}
