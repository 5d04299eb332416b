package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.upload.media.MediaSource;

/**
 * Output of the format normalizer for one attempt.
 *
 * @param source bytes to transfer, the original when nothing changed
 * @param plan conversion that was applied or is still owed server-side
 * @param compressed whether the bytes were re-encoded to reduce size
 */
public record NormalizationResult(MediaSource source, NormalizationPlan plan, boolean compressed) {

    public boolean replacedBytes() {
        return plan == NormalizationPlan.CLIENT_CONVERT || compressed;
    }

    public boolean serverConversionRequired() {
        return plan == NormalizationPlan.SERVER_CONVERT;
    }
}
