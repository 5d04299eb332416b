package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.upload.media.MediaSource;

import java.util.Optional;

/**
 * Produces a still JPEG preview of a video.
 */
public interface VideoThumbnailGenerator {

    /**
     * @return the thumbnail, or empty when none could be produced. Never throws for a bad video.
     */
    Optional<MediaSource> generate(MediaSource video);
}
