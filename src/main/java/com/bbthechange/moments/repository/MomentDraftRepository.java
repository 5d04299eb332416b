package com.bbthechange.moments.repository;

import com.bbthechange.moments.model.MomentDraft;

import java.util.Collection;
import java.util.Set;

/**
 * Record store for event moments in the MomentsTable.
 */
public interface MomentDraftRepository {

    /**
     * Duplicate check.
     * @param eventId The event the batch belongs to
     * @param contentHashes Hashes of the files being ingested
     * @return The subset of hashes already present on a moment of the event, draft or published
     */
    Set<String> findExistingContentHashes(String eventId, Collection<String> contentHashes);

    /**
     * Create a draft. Never overwrites an existing moment.
     * @param draft The draft to store
     * @return The stored draft
     */
    MomentDraft save(MomentDraft draft);

    /**
     * Promote every draft of the event authored by the user.
     * @return Number of drafts promoted; zero when nothing is left in draft
     */
    int publishDrafts(String eventId, String userId);

    void delete(String eventId, String momentId);
}
