package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.exception.DraftSaveException;
import com.bbthechange.moments.model.MomentDraft;
import com.bbthechange.moments.repository.MomentDraftRepository;
import com.bbthechange.moments.upload.state.BatchUploadState;
import com.bbthechange.moments.upload.state.FileUploadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records stored bytes as an unpublished moment.
 */
@Component
public class DraftRecorder {

    private static final Logger logger = LoggerFactory.getLogger(DraftRecorder.class);

    private final MomentDraftRepository momentDraftRepository;

    public DraftRecorder(MomentDraftRepository momentDraftRepository) {
        this.momentDraftRepository = momentDraftRepository;
    }

    /**
     * Blocking. The file snapshot must be read right before the call so a caption set during
     * upload is persisted.
     *
     * @return id of the new draft
     * @throws DraftSaveException if the record store rejected the draft
     */
    public String record(BatchUploadState batch, FileUploadState file) {
        MomentDraft draft = new MomentDraft(batch.getEventId(), batch.getUserId());
        draft.setBatchId(batch.getBatchId());
        draft.setContentType(file.getMediaKind().getValue());
        draft.setMediaUrl(file.getRemoteMediaUrl());
        draft.setThumbnailUrl(file.getRemoteThumbnailUrl());
        draft.setCaption(file.getCaption());
        draft.setVideoId(file.getRemoteVideoId());
        draft.setContentHash(file.getContentHash());

        try {
            MomentDraft saved = momentDraftRepository.save(draft);
            return saved.getMomentId();
        } catch (RuntimeException e) {
            logger.error("Failed to record draft for {} in batch {}: {}",
                    file.getName(), batch.getBatchId(), e.getMessage());
            throw new DraftSaveException("Failed to save " + file.getName(), e);
        }
    }

    /**
     * Best-effort removal of a draft recorded for a file that already left its batch.
     */
    public void discard(String eventId, String draftId) {
        try {
            momentDraftRepository.delete(eventId, draftId);
        } catch (RuntimeException e) {
            logger.warn("Could not discard draft {} of event {}: {}", draftId, eventId, e.getMessage());
        }
    }
}
