package com.bbthechange.moments.upload.state;

import java.util.List;

/**
 * Every intent that can change a batch. Components never touch {@link BatchUploadState}
 * directly; they submit one of these to the {@link BatchStateStore}.
 */
public interface UploadAction {

    record AddFiles(List<FileUploadState> files) implements UploadAction {
    }

    record RemoveFile(String fileId) implements UploadAction {
    }

    record StartUpload() implements UploadAction {
    }

    record PauseUpload() implements UploadAction {
    }

    record ResumeUpload() implements UploadAction {
    }

    record HashStarted(String fileId) implements UploadAction {
    }

    /**
     * Hashing finished. {@code alreadyInEvent} is the record store's answer to the duplicate check.
     */
    record HashResolved(String fileId, String contentHash, boolean alreadyInEvent) implements UploadAction {
    }

    record HashFailed(String fileId) implements UploadAction {
    }

    record StatusChanged(String fileId, FileStatus status) implements UploadAction {
    }

    record PreviewReplaced(String fileId, String previewRef, MediaKind mediaKind) implements UploadAction {
    }

    record ProgressUpdated(String fileId, int percent) implements UploadAction {
    }

    record TransferSucceeded(
            String fileId,
            String mediaUrl,
            String thumbnailUrl,
            String storageKey,
            String thumbnailKey,
            String videoId,
            String transcodeStatus
    ) implements UploadAction {
    }

    record DraftSaved(String fileId, String draftId) implements UploadAction {
    }

    record FileFailed(String fileId, String error) implements UploadAction {
    }

    record RetryScheduled(String fileId, String error) implements UploadAction {
    }

    record RetryElapsed(String fileId) implements UploadAction {
    }

    record RetryFile(String fileId) implements UploadAction {
    }

    record RetryAllFailed() implements UploadAction {
    }

    record SetCaption(String fileId, String caption) implements UploadAction {
    }

    /**
     * Caption for several files; a null or empty id list targets every file of the batch.
     */
    record SetBatchCaption(List<String> fileIds, String caption) implements UploadAction {
    }

    record ClearComplete() implements UploadAction {
    }

    record Reset(String newBatchId) implements UploadAction {
    }
}
