package com.bbthechange.moments.upload.state;

import com.bbthechange.moments.upload.media.MediaSource;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of one file in a batch. Only the reducer produces new instances.
 */
@Value
@Builder(toBuilder = true)
public class FileUploadState {

    String id;
    MediaSource source;
    String name;
    long sizeBytes;
    MediaKind mediaKind;

    @Builder.Default
    FileStatus status = FileStatus.QUEUED;

    @Builder.Default
    int progressPercent = 0;

    String previewRef;
    String remoteMediaUrl;
    String remoteThumbnailUrl;

    /**
     * Blob storage key of the uploaded object, kept so an undrafted object can be cleaned up.
     */
    String storageKey;
    String thumbnailKey;

    String remoteVideoId;
    String videoTranscodeStatus;
    String draftId;
    String error;

    @Builder.Default
    int retryCount = 0;

    String caption;
    String contentHash;

    /**
     * True once hashing and the duplicate check have run (successfully or not). Only hashed
     * files are eligible for dispatch.
     */
    boolean hashChecked;

    /**
     * Bytes are durably stored but no draft references them yet.
     */
    public boolean isStoredWithoutDraft() {
        return draftId == null && (remoteMediaUrl != null || remoteVideoId != null);
    }
}
