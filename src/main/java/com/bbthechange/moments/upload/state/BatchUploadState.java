package com.bbthechange.moments.upload.state;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of a whole batch. Files keep intake order.
 */
@Value
@Builder(toBuilder = true)
public class BatchUploadState {

    String batchId;
    String eventId;
    String userId;
    int concurrencyLimit;

    @Builder.Default
    BatchStatus status = BatchStatus.IDLE;

    @Builder.Default
    Map<String, FileUploadState> files = Collections.emptyMap();

    public static BatchUploadState initial(String batchId, String eventId, String userId, int concurrencyLimit) {
        return BatchUploadState.builder()
                .batchId(batchId)
                .eventId(eventId)
                .userId(userId)
                .concurrencyLimit(concurrencyLimit)
                .build();
    }

    public FileUploadState file(String id) {
        return files.get(id);
    }

    public int activeCount() {
        return (int) files.values().stream()
                .filter(file -> file.getStatus().isActive())
                .count();
    }

    /**
     * Queued files that finished hashing, in intake order.
     */
    public List<String> dispatchableQueuedIds() {
        return files.values().stream()
                .filter(file -> file.getStatus() == FileStatus.QUEUED && file.isHashChecked())
                .map(FileUploadState::getId)
                .collect(Collectors.toList());
    }

    public boolean allTerminal() {
        return !files.isEmpty() && files.values().stream().allMatch(file -> file.getStatus().isTerminal());
    }

    public BatchStats stats() {
        return BatchStats.of(files.values());
    }

    BatchUploadState withFiles(LinkedHashMap<String, FileUploadState> updated) {
        return toBuilder().files(Collections.unmodifiableMap(updated)).build();
    }
}
