package com.bbthechange.moments.upload.state;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-file upload status and its transition table.
 *
 * <p>Happy path: {@code QUEUED -> HASHING -> QUEUED -> VALIDATING -> [CONVERTING] -> UPLOADING
 * -> SAVING -> COMPLETE}. A duplicate resolves {@code HASHING -> SKIPPED}. A retryable transfer
 * failure goes {@code UPLOADING -> RETRYING -> QUEUED}; any other failure lands in ERROR, which a
 * user retry sends back to QUEUED. A file whose bytes already landed resumes
 * {@code VALIDATING -> SAVING}.
 */
public enum FileStatus {
    QUEUED("queued"),
    HASHING("hashing"),
    VALIDATING("validating"),
    CONVERTING("converting"),
    UPLOADING("uploading"),
    SAVING("saving"),
    RETRYING("retrying"),
    COMPLETE("complete"),
    SKIPPED("skipped"),
    ERROR("error");

    private static final Set<FileStatus> ACTIVE =
            EnumSet.of(VALIDATING, CONVERTING, UPLOADING, SAVING, RETRYING);

    private static final Set<FileStatus> TERMINAL = EnumSet.of(COMPLETE, SKIPPED, ERROR);

    private static final Map<FileStatus, Set<FileStatus>> TRANSITIONS = Map.of(
            QUEUED, EnumSet.of(HASHING, VALIDATING),
            HASHING, EnumSet.of(QUEUED, SKIPPED),
            VALIDATING, EnumSet.of(CONVERTING, UPLOADING, SAVING, ERROR),
            CONVERTING, EnumSet.of(CONVERTING, UPLOADING, ERROR),
            UPLOADING, EnumSet.of(SAVING, RETRYING, ERROR),
            SAVING, EnumSet.of(COMPLETE, ERROR),
            RETRYING, EnumSet.of(QUEUED),
            COMPLETE, EnumSet.noneOf(FileStatus.class),
            SKIPPED, EnumSet.noneOf(FileStatus.class),
            ERROR, EnumSet.of(QUEUED)
    );

    private final String value;

    FileStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether a file in this status occupies one of the batch's concurrency slots.
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean canTransitionTo(FileStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
