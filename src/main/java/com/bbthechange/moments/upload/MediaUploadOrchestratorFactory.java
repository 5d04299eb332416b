package com.bbthechange.moments.upload;

import com.bbthechange.moments.config.MediaUploadProperties;
import com.bbthechange.moments.upload.pipeline.ContentHasher;
import com.bbthechange.moments.upload.pipeline.DraftRecorder;
import com.bbthechange.moments.upload.pipeline.DuplicateChecker;
import com.bbthechange.moments.upload.pipeline.FormatNormalizer;
import com.bbthechange.moments.upload.pipeline.MediaValidationPolicy;
import com.bbthechange.moments.upload.pipeline.TransportAdapter;
import com.bbthechange.moments.upload.pipeline.UploadCollaborators;
import com.bbthechange.moments.upload.media.PreviewRegistry;
import com.bbthechange.moments.upload.timer.ExecutorUploadTimer;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Builds orchestrators wired to the application's shared services, each with its own mailbox
 * thread.
 */
@Component
public class MediaUploadOrchestratorFactory {

    private final UploadSettings settings;
    private final UploadCollaborators collaborators;
    private final PublishCoordinator publishCoordinator;

    public MediaUploadOrchestratorFactory(MediaUploadProperties properties,
                                          ContentHasher contentHasher,
                                          DuplicateChecker duplicateChecker,
                                          MediaValidationPolicy validationPolicy,
                                          FormatNormalizer formatNormalizer,
                                          TransportAdapter transportAdapter,
                                          DraftRecorder draftRecorder,
                                          PreviewRegistry previewRegistry,
                                          PublishCoordinator publishCoordinator,
                                          MeterRegistry meterRegistry,
                                          @Qualifier("uploadIoExecutor") ExecutorService uploadIoExecutor) {
        this.settings = UploadSettings.from(properties);
        this.publishCoordinator = publishCoordinator;
        this.collaborators = new UploadCollaborators(contentHasher, duplicateChecker, validationPolicy,
                formatNormalizer, transportAdapter, draftRecorder, previewRegistry, meterRegistry, uploadIoExecutor);
    }

    public MediaUploadOrchestrator create(String eventId, String userId) {
        String batchId = UUID.randomUUID().toString();
        ExecutorUploadTimer timer = new ExecutorUploadTimer("moments-batch-" + batchId.substring(0, 8));
        return new MediaUploadOrchestrator(batchId, eventId, userId, settings, collaborators,
                publishCoordinator, timer);
    }

    public PublishCoordinator getPublishCoordinator() {
        return publishCoordinator;
    }
}
