package com.bbthechange.moments.upload;

import com.bbthechange.moments.repository.MomentDraftRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Promotes a user's drafts of an event to published. Independent of any running batch and
 * idempotent: nothing left in draft publishes zero.
 */
@Component
public class PublishCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(PublishCoordinator.class);

    private final MomentDraftRepository momentDraftRepository;
    private final MeterRegistry meterRegistry;

    public PublishCoordinator(MomentDraftRepository momentDraftRepository, MeterRegistry meterRegistry) {
        this.momentDraftRepository = momentDraftRepository;
        this.meterRegistry = meterRegistry;
    }

    public int publish(String eventId, String userId) {
        int published = momentDraftRepository.publishDrafts(eventId, userId);
        meterRegistry.counter("moments.publish.drafts").increment(published);
        logger.info("User {} published {} moments for event {}", userId, published, eventId);
        return published;
    }
}
