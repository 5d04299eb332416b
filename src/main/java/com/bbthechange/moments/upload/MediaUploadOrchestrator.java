package com.bbthechange.moments.upload;

import com.bbthechange.moments.upload.media.MediaSource;
import com.bbthechange.moments.upload.media.MediaTypes;
import com.bbthechange.moments.upload.pipeline.FilePipeline;
import com.bbthechange.moments.upload.pipeline.RetryPolicy;
import com.bbthechange.moments.upload.pipeline.UploadCollaborators;
import com.bbthechange.moments.upload.state.BatchStateListener;
import com.bbthechange.moments.upload.state.BatchStateStore;
import com.bbthechange.moments.upload.state.BatchStatus;
import com.bbthechange.moments.upload.state.BatchUploadReducer;
import com.bbthechange.moments.upload.state.BatchUploadState;
import com.bbthechange.moments.upload.state.FileUploadState;
import com.bbthechange.moments.upload.state.UploadAction;
import com.bbthechange.moments.upload.timer.UploadTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * One batch upload: owns the batch state, its scheduler, watchdog and per-file pipeline.
 *
 * <p>The orchestrator is an actor. Every public method may be called from any thread; the work
 * is posted to the batch's mailbox ({@link UploadTimer}) and the returned future completes with
 * the outcome once the mailbox has processed it. Only {@link #publish()} bypasses the mailbox,
 * since publishing does not touch the batch.
 */
public class MediaUploadOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(MediaUploadOrchestrator.class);

    private final BatchStateStore store;
    private final UploadTimer timer;
    private final UploadCollaborators collaborators;
    private final PublishCoordinator publishCoordinator;
    private final UploadScheduler scheduler;
    private final StallWatchdog watchdog;
    private final FilePipeline pipeline;

    private volatile boolean closed;

    public MediaUploadOrchestrator(String batchId, String eventId, String userId, UploadSettings settings,
                                   UploadCollaborators collaborators, PublishCoordinator publishCoordinator,
                                   UploadTimer timer) {
        this.timer = timer;
        this.collaborators = collaborators;
        this.publishCoordinator = publishCoordinator;
        this.store = new BatchStateStore(
                BatchUploadState.initial(batchId, eventId, userId, settings.concurrencyLimit()),
                new BatchUploadReducer(),
                collaborators.previewRegistry());
        this.scheduler = new UploadScheduler(store, timer, settings.staggerDelay(), this::startFile);
        this.pipeline = new FilePipeline(store, timer, collaborators,
                new RetryPolicy(settings.maxRetries(), settings.retryDelays()), scheduler::runPass);
        this.watchdog = new StallWatchdog(store, scheduler, timer, settings.watchdogInterval(),
                collaborators.meterRegistry());
        this.store.addListener(this::onStateChanged);
    }

    public BatchUploadState getState() {
        return store.getState();
    }

    public void addListener(BatchStateListener listener) {
        store.addListener(listener);
    }

    /**
     * Take files into the batch. Each gets a local preview handle and starts hashing right away;
     * dispatch waits for {@link #start()}.
     *
     * @return ids of the new files, in the given order
     */
    public CompletableFuture<List<String>> addFiles(List<? extends MediaSource> sources) {
        return submit(() -> {
            List<FileUploadState> files = new ArrayList<>();
            for (MediaSource source : sources) {
                files.add(FileUploadState.builder()
                        .id(UUID.randomUUID().toString())
                        .source(source)
                        .name(source.getName())
                        .sizeBytes(source.getSizeBytes())
                        .mediaKind(MediaTypes.kindOf(source))
                        .previewRef(collaborators.previewRegistry().register(source))
                        .build());
            }
            store.dispatch(new UploadAction.AddFiles(files));
            List<String> ids = new ArrayList<>();
            for (FileUploadState file : files) {
                ids.add(file.getId());
                pipeline.startHashing(file.getId());
            }
            logger.info("Added {} files to batch {}", ids.size(), store.getState().getBatchId());
            return ids;
        });
    }

    /**
     * Remove a file in any status. An in-flight transfer is not aborted; its result is dropped
     * and anything it stored is deleted.
     */
    public CompletableFuture<Boolean> removeFile(String fileId) {
        return submit(() -> store.dispatch(new UploadAction.RemoveFile(fileId)));
    }

    public CompletableFuture<BatchUploadState> start() {
        return apply(new UploadAction.StartUpload());
    }

    /**
     * Stop dispatching new files. Transfers already running carry on.
     */
    public CompletableFuture<BatchUploadState> pause() {
        return apply(new UploadAction.PauseUpload());
    }

    public CompletableFuture<BatchUploadState> resume() {
        return apply(new UploadAction.ResumeUpload());
    }

    /**
     * Re-queue a failed file with a fresh retry budget. No-op unless the file is in error.
     */
    public CompletableFuture<BatchUploadState> retryFile(String fileId) {
        return submit(() -> {
            if (store.dispatch(new UploadAction.RetryFile(fileId))) {
                scheduler.runPass();
            }
            return store.getState();
        });
    }

    public CompletableFuture<BatchUploadState> retryAllFailed() {
        return submit(() -> {
            if (store.dispatch(new UploadAction.RetryAllFailed())) {
                scheduler.runPass();
            }
            return store.getState();
        });
    }

    public CompletableFuture<BatchUploadState> setCaption(String fileId, String caption) {
        return apply(new UploadAction.SetCaption(fileId, caption));
    }

    /**
     * @param fileIds files to caption; null or empty captions the whole batch
     */
    public CompletableFuture<BatchUploadState> setBatchCaption(List<String> fileIds, String caption) {
        return apply(new UploadAction.SetBatchCaption(fileIds, caption));
    }

    public CompletableFuture<BatchUploadState> clearComplete() {
        return apply(new UploadAction.ClearComplete());
    }

    /**
     * Discard every file and start over under a new batch id.
     */
    public CompletableFuture<BatchUploadState> reset() {
        return submit(() -> {
            resetInternal();
            return store.getState();
        });
    }

    /**
     * Promote the user's drafts for this batch's event.
     *
     * @return number of drafts promoted
     */
    public CompletableFuture<Integer> publish() {
        BatchUploadState state = store.getState();
        return CompletableFuture.supplyAsync(
                () -> publishCoordinator.publish(state.getEventId(), state.getUserId()),
                collaborators.ioExecutor());
    }

    /**
     * Discard the batch and stop its mailbox. Later calls fail.
     */
    public CompletableFuture<Void> close() {
        CompletableFuture<Void> result = submit(() -> {
            resetInternal();
            return null;
        });
        closed = true;
        timer.execute(timer::shutdown);
        return result;
    }

    public boolean isClosed() {
        return closed;
    }

    private void resetInternal() {
        scheduler.cancel();
        watchdog.stop();
        pipeline.cancelAllRetries();
        String previousId = store.getState().getBatchId();
        store.dispatch(new UploadAction.Reset(UUID.randomUUID().toString()));
        logger.info("Batch {} reset as {}", previousId, store.getState().getBatchId());
    }

    private void startFile(String fileId) {
        pipeline.start(fileId);
    }

    private CompletableFuture<BatchUploadState> apply(UploadAction action) {
        return submit(() -> {
            store.dispatch(action);
            return store.getState();
        });
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (closed) {
            result.completeExceptionally(new IllegalStateException("Upload batch is closed"));
            return result;
        }
        boolean accepted = timer.execute(() -> {
            try {
                result.complete(task.get());
            } catch (RuntimeException e) {
                logger.error("Batch operation failed in {}", store.getState().getBatchId(), e);
                result.completeExceptionally(e);
            }
        });
        if (!accepted) {
            result.completeExceptionally(new IllegalStateException("Upload batch is closed"));
        }
        return result;
    }

    private void onStateChanged(BatchUploadState previous, BatchUploadState current, UploadAction action) {
        for (FileUploadState file : previous.getFiles().values()) {
            if (current.file(file.getId()) == null) {
                detach(file);
            }
        }

        boolean wasUploading = previous.getStatus() == BatchStatus.UPLOADING;
        boolean isUploading = current.getStatus() == BatchStatus.UPLOADING;
        if (!wasUploading && isUploading) {
            watchdog.start();
            scheduler.requestPass();
        } else if (wasUploading && !isUploading) {
            watchdog.stop();
        }

        if (current.getStatus() == BatchStatus.COMPLETE && previous.getStatus() != BatchStatus.COMPLETE) {
            logger.info("Batch {} complete: {}", current.getBatchId(), current.stats());
        }
    }

    private void detach(FileUploadState file) {
        pipeline.cancelRetry(file.getId());
        if (file.isStoredWithoutDraft()) {
            if (file.getStorageKey() != null) {
                logger.info("Deleting undrafted object {} of removed file {}", file.getStorageKey(), file.getName());
            }
            pipeline.deleteStoredObject(file.getStorageKey());
            pipeline.deleteStoredObject(file.getThumbnailKey());
        }
        file.getSource().release();
    }
}
