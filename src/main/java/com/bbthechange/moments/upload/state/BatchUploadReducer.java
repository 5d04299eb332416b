package com.bbthechange.moments.upload.state;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Pure transition function {@code (state, action) -> state}.
 *
 * <p>An action whose precondition does not hold (unknown file, status not allowed by
 * {@link FileStatus#canTransitionTo}) returns the same instance unchanged. After every change the
 * aggregate status is re-derived: a running or paused batch whose files are all terminal becomes
 * COMPLETE, and a COMPLETE batch that gains non-terminal work goes back to UPLOADING.
 */
public final class BatchUploadReducer {

    public BatchUploadState reduce(BatchUploadState state, UploadAction action) {
        BatchUploadState next = apply(state, action);
        return next == state ? state : deriveBatchStatus(next);
    }

    private BatchUploadState apply(BatchUploadState state, UploadAction action) {
        if (action instanceof UploadAction.AddFiles add) {
            return addFiles(state, add.files());
        }
        if (action instanceof UploadAction.RemoveFile remove) {
            return removeFile(state, remove.fileId());
        }
        if (action instanceof UploadAction.StartUpload) {
            return withBatchStatus(state, BatchStatus.UPLOADING, BatchStatus.IDLE, BatchStatus.PAUSED);
        }
        if (action instanceof UploadAction.PauseUpload) {
            return withBatchStatus(state, BatchStatus.PAUSED, BatchStatus.UPLOADING);
        }
        if (action instanceof UploadAction.ResumeUpload) {
            return withBatchStatus(state, BatchStatus.UPLOADING, BatchStatus.PAUSED);
        }
        if (action instanceof UploadAction.HashStarted hashStarted) {
            FileUploadState file = state.file(hashStarted.fileId());
            if (file == null || file.isHashChecked()) {
                return state;
            }
            return transition(state, hashStarted.fileId(), FileStatus.HASHING, UnaryOperator.identity());
        }
        if (action instanceof UploadAction.HashResolved resolved) {
            return hashResolved(state, resolved);
        }
        if (action instanceof UploadAction.HashFailed failed) {
            return transition(state, failed.fileId(), FileStatus.QUEUED,
                    file -> file.toBuilder().hashChecked(true).build());
        }
        if (action instanceof UploadAction.StatusChanged changed) {
            return transition(state, changed.fileId(), changed.status(), file -> changed.status() == FileStatus.UPLOADING
                    ? file.toBuilder().progressPercent(0).build()
                    : file);
        }
        if (action instanceof UploadAction.PreviewReplaced replaced) {
            return update(state, replaced.fileId(), file -> file.getStatus().isTerminal()
                    ? file
                    : file.toBuilder()
                        .previewRef(replaced.previewRef())
                        .mediaKind(replaced.mediaKind() != null ? replaced.mediaKind() : file.getMediaKind())
                        .build());
        }
        if (action instanceof UploadAction.ProgressUpdated progress) {
            return update(state, progress.fileId(), file -> progressed(file, progress.percent()));
        }
        if (action instanceof UploadAction.TransferSucceeded success) {
            return transition(state, success.fileId(), FileStatus.SAVING, file -> file.toBuilder()
                    .progressPercent(100)
                    .remoteMediaUrl(success.mediaUrl())
                    .remoteThumbnailUrl(success.thumbnailUrl())
                    .storageKey(success.storageKey())
                    .thumbnailKey(success.thumbnailKey())
                    .remoteVideoId(success.videoId())
                    .videoTranscodeStatus(success.transcodeStatus())
                    .previewRef(remotePreview(file, success))
                    .build());
        }
        if (action instanceof UploadAction.DraftSaved saved) {
            return transition(state, saved.fileId(), FileStatus.COMPLETE, file -> file.toBuilder()
                    .draftId(saved.draftId())
                    .error(null)
                    .build());
        }
        if (action instanceof UploadAction.FileFailed failed) {
            FileUploadState file = state.file(failed.fileId());
            if (file == null || !file.getStatus().isActive()) {
                return state;
            }
            return transition(state, failed.fileId(), FileStatus.ERROR,
                    f -> f.toBuilder().error(failed.error()).build());
        }
        if (action instanceof UploadAction.RetryScheduled scheduled) {
            return transition(state, scheduled.fileId(), FileStatus.RETRYING, file -> file.toBuilder()
                    .retryCount(file.getRetryCount() + 1)
                    .progressPercent(0)
                    .error(scheduled.error())
                    .build());
        }
        if (action instanceof UploadAction.RetryElapsed elapsed) {
            FileUploadState file = state.file(elapsed.fileId());
            if (file == null || file.getStatus() != FileStatus.RETRYING) {
                return state;
            }
            return transition(state, elapsed.fileId(), FileStatus.QUEUED,
                    f -> f.toBuilder().error(null).build());
        }
        if (action instanceof UploadAction.RetryFile retry) {
            FileUploadState file = state.file(retry.fileId());
            if (file == null || file.getStatus() != FileStatus.ERROR) {
                return state;
            }
            return transition(state, retry.fileId(), FileStatus.QUEUED, BatchUploadReducer::requeued);
        }
        if (action instanceof UploadAction.RetryAllFailed) {
            return retryAllFailed(state);
        }
        if (action instanceof UploadAction.SetCaption caption) {
            return update(state, caption.fileId(), file -> captioned(file, caption.caption()));
        }
        if (action instanceof UploadAction.SetBatchCaption batchCaption) {
            return setBatchCaption(state, batchCaption.fileIds(), batchCaption.caption());
        }
        if (action instanceof UploadAction.ClearComplete) {
            return clearComplete(state);
        }
        if (action instanceof UploadAction.Reset reset) {
            return BatchUploadState.initial(reset.newBatchId(), state.getEventId(), state.getUserId(),
                    state.getConcurrencyLimit());
        }
        return state;
    }

    private BatchUploadState addFiles(BatchUploadState state, List<FileUploadState> incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return state;
        }
        LinkedHashMap<String, FileUploadState> files = new LinkedHashMap<>(state.getFiles());
        boolean added = false;
        for (FileUploadState file : incoming) {
            if (file != null && file.getId() != null && !files.containsKey(file.getId())) {
                files.put(file.getId(), file);
                added = true;
            }
        }
        return added ? state.withFiles(files) : state;
    }

    private BatchUploadState removeFile(BatchUploadState state, String fileId) {
        if (!state.getFiles().containsKey(fileId)) {
            return state;
        }
        LinkedHashMap<String, FileUploadState> files = new LinkedHashMap<>(state.getFiles());
        files.remove(fileId);
        return state.withFiles(files);
    }

    private BatchUploadState hashResolved(BatchUploadState state, UploadAction.HashResolved resolved) {
        FileUploadState file = state.file(resolved.fileId());
        if (file == null || file.getStatus() != FileStatus.HASHING) {
            return state;
        }
        boolean duplicate = resolved.alreadyInEvent() || hashTakenByAnotherFile(state, file.getId(), resolved.contentHash());
        FileStatus target = duplicate ? FileStatus.SKIPPED : FileStatus.QUEUED;
        return transition(state, file.getId(), target, f -> f.toBuilder()
                .contentHash(resolved.contentHash())
                .hashChecked(true)
                .build());
    }

    private boolean hashTakenByAnotherFile(BatchUploadState state, String fileId, String hash) {
        if (hash == null) {
            return false;
        }
        return state.getFiles().values().stream()
                .anyMatch(other -> !other.getId().equals(fileId)
                        && other.getStatus() != FileStatus.SKIPPED
                        && hash.equals(other.getContentHash()));
    }

    private BatchUploadState retryAllFailed(BatchUploadState state) {
        LinkedHashMap<String, FileUploadState> files = new LinkedHashMap<>(state.getFiles());
        boolean changed = false;
        for (Map.Entry<String, FileUploadState> entry : files.entrySet()) {
            if (entry.getValue().getStatus() == FileStatus.ERROR) {
                entry.setValue(requeued(entry.getValue()));
                changed = true;
            }
        }
        if (!changed) {
            return state;
        }
        BatchUploadState next = state.withFiles(files);
        return next.getStatus() == BatchStatus.IDLE ? next : next.toBuilder().status(BatchStatus.UPLOADING).build();
    }

    private BatchUploadState setBatchCaption(BatchUploadState state, List<String> fileIds, String caption) {
        Set<String> targets = fileIds == null || fileIds.isEmpty()
                ? state.getFiles().keySet()
                : new HashSet<>(fileIds);
        LinkedHashMap<String, FileUploadState> files = new LinkedHashMap<>(state.getFiles());
        boolean changed = false;
        for (Map.Entry<String, FileUploadState> entry : files.entrySet()) {
            if (targets.contains(entry.getKey())) {
                FileUploadState updated = captioned(entry.getValue(), caption);
                if (updated != entry.getValue()) {
                    entry.setValue(updated);
                    changed = true;
                }
            }
        }
        return changed ? state.withFiles(files) : state;
    }

    private BatchUploadState clearComplete(BatchUploadState state) {
        LinkedHashMap<String, FileUploadState> files = new LinkedHashMap<>(state.getFiles());
        boolean removed = files.values().removeIf(file -> file.getStatus() == FileStatus.COMPLETE);
        return removed ? state.withFiles(files) : state;
    }

    private BatchUploadState withBatchStatus(BatchUploadState state, BatchStatus target, BatchStatus... from) {
        for (BatchStatus allowed : from) {
            if (state.getStatus() == allowed) {
                return state.toBuilder().status(target).build();
            }
        }
        return state;
    }

    private BatchUploadState transition(BatchUploadState state, String fileId, FileStatus target,
                                        UnaryOperator<FileUploadState> change) {
        FileUploadState file = state.file(fileId);
        if (file == null || target == null || !file.getStatus().canTransitionTo(target)) {
            return state;
        }
        FileUploadState moved = change.apply(file).toBuilder().status(target).build();
        return replace(state, moved);
    }

    private BatchUploadState update(BatchUploadState state, String fileId, UnaryOperator<FileUploadState> change) {
        FileUploadState file = state.file(fileId);
        if (file == null) {
            return state;
        }
        FileUploadState updated = change.apply(file);
        return updated == file ? state : replace(state, updated);
    }

    private BatchUploadState replace(BatchUploadState state, FileUploadState file) {
        LinkedHashMap<String, FileUploadState> files = new LinkedHashMap<>(state.getFiles());
        files.put(file.getId(), file);
        return state.withFiles(files);
    }

    private BatchUploadState deriveBatchStatus(BatchUploadState state) {
        BatchStatus status = state.getStatus();
        if ((status == BatchStatus.UPLOADING || status == BatchStatus.PAUSED) && state.allTerminal()) {
            return state.toBuilder().status(BatchStatus.COMPLETE).build();
        }
        if (status == BatchStatus.COMPLETE && !state.allTerminal()) {
            return state.toBuilder()
                    .status(state.getFiles().isEmpty() ? BatchStatus.IDLE : BatchStatus.UPLOADING)
                    .build();
        }
        return state;
    }

    private static FileUploadState progressed(FileUploadState file, int percent) {
        if (file.getStatus() != FileStatus.UPLOADING) {
            return file;
        }
        int clamped = Math.max(0, Math.min(100, percent));
        return clamped > file.getProgressPercent() ? file.toBuilder().progressPercent(clamped).build() : file;
    }

    private static FileUploadState captioned(FileUploadState file, String caption) {
        if (file.getDraftId() != null || file.getStatus() == FileStatus.SKIPPED) {
            return file;
        }
        String normalized = caption == null || caption.isBlank() ? null : caption.trim();
        if (normalized == null ? file.getCaption() == null : normalized.equals(file.getCaption())) {
            return file;
        }
        return file.toBuilder().caption(normalized).build();
    }

    // Remote bytes and hash are kept so a file whose draft save failed resumes at saving.
    private static FileUploadState requeued(FileUploadState file) {
        return file.toBuilder()
                .status(FileStatus.QUEUED)
                .error(null)
                .retryCount(0)
                .progressPercent(0)
                .build();
    }

    private static String remotePreview(FileUploadState file, UploadAction.TransferSucceeded success) {
        if (success.mediaUrl() != null && file.getMediaKind() == MediaKind.PHOTO) {
            return success.mediaUrl();
        }
        if (success.thumbnailUrl() != null) {
            return success.thumbnailUrl();
        }
        return success.mediaUrl() != null ? success.mediaUrl() : file.getPreviewRef();
    }
}
