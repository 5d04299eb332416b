package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.upload.media.MediaSource;
import com.bbthechange.moments.upload.state.MediaKind;

/**
 * One transfer attempt of a normalized file.
 */
public record TransferRequest(
        String eventId,
        String userId,
        String fileId,
        MediaSource source,
        MediaKind mediaKind,
        boolean serverConversionRequired
) {
}
