package com.bbthechange.moments.upload.pipeline;

/**
 * Where a file's bytes ended up. Streamed videos carry a video id and no media URL; everything
 * stored in blob storage carries its storage key. A video thumbnail carries its own key.
 */
public record TransferResult(
        String mediaUrl,
        String thumbnailUrl,
        String storageKey,
        String thumbnailKey,
        String videoId,
        String transcodeStatus
) {
}
