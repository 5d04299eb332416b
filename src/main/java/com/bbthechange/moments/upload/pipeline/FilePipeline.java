package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.exception.MediaConversionException;
import com.bbthechange.moments.upload.media.MediaSource;
import com.bbthechange.moments.upload.media.MediaTypes;
import com.bbthechange.moments.upload.state.BatchStateStore;
import com.bbthechange.moments.upload.state.BatchUploadState;
import com.bbthechange.moments.upload.state.FileStatus;
import com.bbthechange.moments.upload.state.FileUploadState;
import com.bbthechange.moments.upload.state.UploadAction;
import com.bbthechange.moments.upload.timer.TimerHandle;
import com.bbthechange.moments.upload.timer.UploadTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs one file through hash, validate, normalize, transfer and draft save.
 *
 * <p>Every method here runs on the batch's mailbox. Blocking steps go to the shared I/O executor
 * and their results come back as mailbox tasks, which re-read the store before acting. A result
 * for a file that has left the batch (or a batch that was reset) is dropped, and whatever it
 * stored remotely is deleted.
 */
public class FilePipeline {

    private static final Logger logger = LoggerFactory.getLogger(FilePipeline.class);

    private final BatchStateStore store;
    private final UploadTimer timer;
    private final UploadCollaborators collaborators;
    private final RetryPolicy retryPolicy;
    private final Runnable onOutcome;
    private final Map<String, TimerHandle> retryTimers = new HashMap<>();

    /**
     * @param onOutcome invoked on the mailbox after every terminal outcome or scheduled retry, so
     *                  freed slots are refilled
     */
    public FilePipeline(BatchStateStore store, UploadTimer timer, UploadCollaborators collaborators,
                        RetryPolicy retryPolicy, Runnable onOutcome) {
        this.store = store;
        this.timer = timer;
        this.collaborators = collaborators;
        this.retryPolicy = retryPolicy;
        this.onOutcome = onOutcome;
    }

    /**
     * Hash a freshly added file and check the event for an existing copy. Failures are not
     * fatal: the file becomes dispatchable without a hash.
     */
    public void startHashing(String fileId) {
        if (!store.dispatch(new UploadAction.HashStarted(fileId))) {
            return;
        }
        BatchUploadState batch = store.getState();
        FileUploadState file = batch.file(fileId);
        String batchId = batch.getBatchId();
        String eventId = batch.getEventId();
        MediaSource source = file.getSource();

        runBlocking(() -> {
            String hash;
            try {
                hash = collaborators.contentHasher().hash(source);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
            boolean exists = collaborators.duplicateChecker().existsInEvent(eventId, hash);
            return new UploadAction.HashResolved(fileId, hash, exists);
        }, (resolved, error) -> {
            if (!isCurrent(batchId, fileId)) {
                return;
            }
            if (error != null) {
                logger.warn("Could not hash {}, it will upload without deduplication: {}",
                        file.getName(), error.getMessage());
                store.dispatch(new UploadAction.HashFailed(fileId));
            } else {
                store.dispatch(resolved);
                if (store.getState().file(fileId).getStatus() == FileStatus.SKIPPED) {
                    logger.info("Skipping {} in batch {}: duplicate content", file.getName(), batchId);
                    outcome("skipped");
                }
            }
            onOutcome.run();
        });
    }

    /**
     * Start a queued file. Must leave the file in an active or terminal status before returning,
     * so the scheduler never selects it twice.
     */
    public void start(String fileId) {
        BatchUploadState batch = store.getState();
        FileUploadState file = batch.file(fileId);
        if (file == null || file.getStatus() != FileStatus.QUEUED) {
            return;
        }
        if (file.getDraftId() != null) {
            logger.warn("File {} already has draft {}, not uploading again", fileId, file.getDraftId());
            return;
        }

        store.dispatch(new UploadAction.StatusChanged(fileId, FileStatus.VALIDATING));

        if (file.isStoredWithoutDraft()) {
            logger.info("Bytes of {} are already stored, retrying the draft save only", file.getName());
            store.dispatch(new UploadAction.StatusChanged(fileId, FileStatus.SAVING));
            saveDraft(fileId);
            return;
        }

        Optional<String> rejection = collaborators.validationPolicy().validate(file.getSource());
        if (rejection.isPresent()) {
            logger.info("Rejected {}: {}", file.getName(), rejection.get());
            fail(fileId, rejection.get());
            return;
        }

        MediaSource source = file.getSource();
        if (!collaborators.formatNormalizer().requiresWork(source)) {
            transfer(fileId, new NormalizationResult(source, NormalizationPlan.NONE, false));
            return;
        }

        store.dispatch(new UploadAction.StatusChanged(fileId, FileStatus.CONVERTING));
        String batchId = batch.getBatchId();
        runBlocking(() -> collaborators.formatNormalizer().normalize(source), (result, error) -> {
            if (!isCurrent(batchId, fileId)) {
                return;
            }
            if (error != null) {
                String message = error instanceof MediaConversionException
                        ? error.getMessage()
                        : "Conversion failed: " + error.getMessage();
                fail(fileId, message);
                return;
            }
            transfer(fileId, result);
        });
    }

    private void transfer(String fileId, NormalizationResult normalized) {
        BatchUploadState batch = store.getState();
        String batchId = batch.getBatchId();

        if (normalized.replacedBytes()) {
            String handle = collaborators.previewRegistry().register(normalized.source());
            store.dispatch(new UploadAction.PreviewReplaced(fileId, handle, MediaTypes.kindOf(normalized.source())));
        }
        if (!store.dispatch(new UploadAction.StatusChanged(fileId, FileStatus.UPLOADING))) {
            return;
        }

        FileUploadState file = store.getState().file(fileId);
        TransferRequest request = new TransferRequest(batch.getEventId(), batch.getUserId(), fileId,
                normalized.source(), file.getMediaKind(), normalized.serverConversionRequired());

        runBlocking(() -> collaborators.transportAdapter().transfer(request,
                percent -> timer.execute(() -> store.dispatch(new UploadAction.ProgressUpdated(fileId, percent)))),
                (result, error) -> {
                    if (!isCurrent(batchId, fileId)) {
                        if (result != null) {
                            logger.info("File {} left the batch during transfer, deleting its stored object", fileId);
                            discardTransfer(result);
                        }
                        return;
                    }
                    if (error != null) {
                        handleTransferFailure(fileId, error);
                        return;
                    }
                    store.dispatch(new UploadAction.TransferSucceeded(fileId, result.mediaUrl(), result.thumbnailUrl(),
                            result.storageKey(), result.thumbnailKey(), result.videoId(), result.transcodeStatus()));
                    saveDraft(fileId);
                }, result -> {
                    logger.info("Batch {} closed during transfer of {}, deleting its stored object", batchId, fileId);
                    discardTransfer(result);
                });
    }

    private void handleTransferFailure(String fileId, Throwable error) {
        FileUploadState file = store.getState().file(fileId);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        Optional<Duration> delay = retryPolicy.nextDelay(file.getRetryCount());

        if (delay.isEmpty()) {
            logger.warn("Upload of {} failed after {} retries: {}", file.getName(), file.getRetryCount(), message);
            fail(fileId, message);
            return;
        }

        logger.warn("Upload of {} failed (retry {}/{} in {}ms): {}", file.getName(), file.getRetryCount() + 1,
                retryPolicy.getMaxRetries(), delay.get().toMillis(), message);
        store.dispatch(new UploadAction.RetryScheduled(fileId, message));
        collaborators.meterRegistry().counter("moments.upload.retries").increment();
        retryTimers.put(fileId, timer.schedule(() -> {
            retryTimers.remove(fileId);
            if (store.dispatch(new UploadAction.RetryElapsed(fileId))) {
                onOutcome.run();
            }
        }, delay.get()));
        onOutcome.run();
    }

    private void saveDraft(String fileId) {
        BatchUploadState batch = store.getState();
        FileUploadState file = batch.file(fileId);
        String batchId = batch.getBatchId();

        runBlocking(() -> collaborators.draftRecorder().record(batch, file), (draftId, error) -> {
            if (!isCurrent(batchId, fileId)) {
                if (draftId != null) {
                    logger.info("File {} left the batch while saving, discarding draft {}", fileId, draftId);
                    discardDraft(batch.getEventId(), draftId);
                }
                return;
            }
            if (error != null) {
                fail(fileId, error.getMessage());
                return;
            }
            store.dispatch(new UploadAction.DraftSaved(fileId, draftId));
            logger.info("Uploaded {} as draft {} in batch {}", file.getName(), draftId, batchId);
            outcome("complete");
            onOutcome.run();
        }, draftId -> {
            logger.info("Batch {} closed while saving {}, discarding draft {}", batchId, fileId, draftId);
            discardDraft(batch.getEventId(), draftId);
        });
    }

    private void discardTransfer(TransferResult result) {
        deleteStoredObject(result.storageKey());
        deleteStoredObject(result.thumbnailKey());
    }

    private void discardDraft(String eventId, String draftId) {
        collaborators.ioExecutor().execute(() -> collaborators.draftRecorder().discard(eventId, draftId));
    }

    private void fail(String fileId, String message) {
        if (store.dispatch(new UploadAction.FileFailed(fileId, message))) {
            outcome("error");
        }
        onOutcome.run();
    }

    /**
     * Stop a pending retry delay of a file that left the batch.
     */
    public void cancelRetry(String fileId) {
        TimerHandle handle = retryTimers.remove(fileId);
        if (handle != null) {
            handle.cancel();
        }
    }

    public void cancelAllRetries() {
        retryTimers.values().forEach(TimerHandle::cancel);
        retryTimers.clear();
    }

    /**
     * Best-effort delete of an object no draft will reference, off the mailbox.
     */
    public void deleteStoredObject(String storageKey) {
        if (storageKey == null) {
            return;
        }
        collaborators.ioExecutor().execute(() -> collaborators.transportAdapter().deleteQuietly(storageKey));
    }

    private boolean isCurrent(String batchId, String fileId) {
        BatchUploadState current = store.getState();
        return current.getBatchId().equals(batchId) && current.file(fileId) != null;
    }

    private void outcome(String outcome) {
        collaborators.meterRegistry().counter("moments.upload.files", "outcome", outcome).increment();
    }

    /**
     * Run blocking work on the I/O executor and hand its result back to the mailbox.
     */
    private <T> void runBlocking(Supplier<T> work, BiConsumer<T, Throwable> onMailbox) {
        runBlocking(work, onMailbox, null);
    }

    /**
     * As above. When the mailbox is already shut down a successful result goes to {@code onClosed}
     * instead, on the completing thread, so whatever it created can still be cleaned up.
     */
    private <T> void runBlocking(Supplier<T> work, BiConsumer<T, Throwable> onMailbox, Consumer<T> onClosed) {
        CompletableFuture.supplyAsync(work, collaborators.ioExecutor())
                .whenComplete((result, error) -> {
                    boolean delivered = timer.execute(() -> onMailbox.accept(result, unwrap(error)));
                    if (!delivered && onClosed != null && error == null && result != null) {
                        onClosed.accept(result);
                    }
                });
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
