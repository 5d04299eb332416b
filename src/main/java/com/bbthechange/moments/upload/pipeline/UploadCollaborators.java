package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.upload.media.PreviewRegistry;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.Executor;

/**
 * Stateless services shared by every batch. One instance is built by the orchestrator factory;
 * tests assemble their own around mocks.
 */
public record UploadCollaborators(
        ContentHasher contentHasher,
        DuplicateChecker duplicateChecker,
        MediaValidationPolicy validationPolicy,
        FormatNormalizer formatNormalizer,
        TransportAdapter transportAdapter,
        DraftRecorder draftRecorder,
        PreviewRegistry previewRegistry,
        MeterRegistry meterRegistry,
        Executor ioExecutor
) {
}
