package com.bbthechange.moments.dto;

import com.bbthechange.moments.upload.state.BatchStats;
import com.bbthechange.moments.upload.state.BatchUploadState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Point-in-time view of an upload batch. {@code sessionId} is stable for the life of the batch
 * session; {@code batchId} changes on every reset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchSnapshotResponse {

    private String sessionId;
    private String batchId;
    private String eventId;
    private String status;
    private int concurrencyLimit;
    private BatchStats stats;
    private List<FileUploadDTO> files;

    public static BatchSnapshotResponse from(String sessionId, BatchUploadState state) {
        return new BatchSnapshotResponse(
                sessionId,
                state.getBatchId(),
                state.getEventId(),
                state.getStatus().getValue(),
                state.getConcurrencyLimit(),
                state.stats(),
                state.getFiles().values().stream()
                        .map(FileUploadDTO::from)
                        .collect(Collectors.toList()));
    }
}
