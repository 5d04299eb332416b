package com.bbthechange.moments.upload.state;

import java.util.Collection;

/**
 * Aggregate counts over a batch's files.
 */
public record BatchStats(
        int total,
        int queued,
        int hashing,
        int active,
        int saving,
        int complete,
        int skipped,
        int failed
) {

    public static BatchStats of(Collection<FileUploadState> files) {
        int queued = 0;
        int hashing = 0;
        int active = 0;
        int saving = 0;
        int complete = 0;
        int skipped = 0;
        int failed = 0;
        for (FileUploadState file : files) {
            FileStatus status = file.getStatus();
            if (status.isActive()) {
                active++;
            }
            switch (status) {
                case QUEUED -> queued++;
                case HASHING -> hashing++;
                case SAVING -> saving++;
                case COMPLETE -> complete++;
                case SKIPPED -> skipped++;
                case ERROR -> failed++;
                default -> {
                }
            }
        }
        return new BatchStats(files.size(), queued, hashing, active, saving, complete, skipped, failed);
    }
}
