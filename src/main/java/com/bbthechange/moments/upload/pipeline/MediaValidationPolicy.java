package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.config.MediaUploadProperties;
import com.bbthechange.moments.upload.media.MediaSource;
import com.bbthechange.moments.upload.media.MediaTypes;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Accepts common raster images, GIFs, the convertible photo containers and web/legacy videos,
 * within per-kind size limits.
 */
@Component
public class MediaValidationPolicy {

    static final String UNSUPPORTED_FORMAT =
            "Unsupported format. Use JPEG, PNG, WebP, HEIC, GIF, MP4, WebM, or MOV";

    private final long photoMaxBytes;
    private final long videoMaxBytes;

    @Autowired
    public MediaValidationPolicy(MediaUploadProperties properties) {
        this(properties.getPhotoMaxSize().toBytes(), properties.getVideoMaxSize().toBytes());
    }

    public MediaValidationPolicy(long photoMaxBytes, long videoMaxBytes) {
        this.photoMaxBytes = photoMaxBytes;
        this.videoMaxBytes = videoMaxBytes;
    }

    /**
     * @return the rejection message, or empty when the file is acceptable
     */
    public Optional<String> validate(MediaSource source) {
        String type = MediaTypes.effectiveContentType(source);
        boolean photo = MediaTypes.RASTER_IMAGE_TYPES.contains(type)
                || MediaTypes.GIF_TYPE.equals(type)
                || MediaTypes.isConvertibleImage(source);
        boolean video = MediaTypes.VIDEO_TYPES.contains(type) || MediaTypes.isLegacyVideo(source);

        if (!photo && !video) {
            return Optional.of(UNSUPPORTED_FORMAT);
        }
        if (video && source.getSizeBytes() > videoMaxBytes) {
            return Optional.of("Videos must be less than " + megabytes(videoMaxBytes) + "MB");
        }
        if (photo && !video && source.getSizeBytes() > photoMaxBytes) {
            return Optional.of("Photos must be less than " + megabytes(photoMaxBytes) + "MB");
        }
        return Optional.empty();
    }

    private static long megabytes(long bytes) {
        return bytes / (1024 * 1024);
    }
}
