package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.repository.MomentDraftRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Asks the record store whether an event already holds a moment with the same content.
 */
@Component
public class DuplicateChecker {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateChecker.class);

    private final MomentDraftRepository momentDraftRepository;

    public DuplicateChecker(MomentDraftRepository momentDraftRepository) {
        this.momentDraftRepository = momentDraftRepository;
    }

    /**
     * Blocking. A failed lookup counts as "not present": the file is uploaded rather than blocked.
     */
    public boolean existsInEvent(String eventId, String contentHash) {
        try {
            return momentDraftRepository.findExistingContentHashes(eventId, Set.of(contentHash))
                    .contains(contentHash);
        } catch (RuntimeException e) {
            logger.warn("Duplicate check for event {} failed, uploading anyway: {}", eventId, e.getMessage());
            return false;
        }
    }
}
