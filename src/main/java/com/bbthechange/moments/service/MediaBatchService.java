package com.bbthechange.moments.service;

import com.bbthechange.moments.dto.AddFilesResponse;
import com.bbthechange.moments.dto.BatchSnapshotResponse;
import com.bbthechange.moments.dto.PublishResponse;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Upload batch sessions for the REST surface. A session wraps one orchestrator and is only
 * visible to the user who opened it; any other caller gets a not-found.
 */
public interface MediaBatchService {

    BatchSnapshotResponse openBatch(String eventId, String userId);

    BatchSnapshotResponse getBatch(String sessionId, String userId);

    AddFilesResponse addFiles(String sessionId, String userId, List<MultipartFile> files);

    BatchSnapshotResponse removeFile(String sessionId, String userId, String fileId);

    BatchSnapshotResponse start(String sessionId, String userId);

    BatchSnapshotResponse pause(String sessionId, String userId);

    BatchSnapshotResponse resume(String sessionId, String userId);

    BatchSnapshotResponse retryFile(String sessionId, String userId, String fileId);

    BatchSnapshotResponse retryAllFailed(String sessionId, String userId);

    BatchSnapshotResponse setCaption(String sessionId, String userId, String fileId, String caption);

    BatchSnapshotResponse setBatchCaption(String sessionId, String userId, List<String> fileIds, String caption);

    BatchSnapshotResponse clearComplete(String sessionId, String userId);

    BatchSnapshotResponse reset(String sessionId, String userId);

    PublishResponse publishBatch(String sessionId, String userId);

    /**
     * Publish the user's drafts for an event without an open batch.
     */
    PublishResponse publishEvent(String eventId, String userId);

    /**
     * Reset the batch and stop its mailbox thread. The session is gone afterwards.
     */
    void discard(String sessionId, String userId);
}
