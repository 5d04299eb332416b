package com.bbthechange.moments.upload.pipeline;

import com.bbthechange.moments.upload.media.InMemoryMediaSource;
import com.bbthechange.moments.upload.media.MediaSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;

class MediaValidationPolicyTest {

    private static final long MB = 1024 * 1024;

    private final MediaValidationPolicy policy = new MediaValidationPolicy(15 * MB, 50 * MB);

    @ParameterizedTest
    @CsvSource({
            "photo.jpg, image/jpeg",
            "photo.png, image/png",
            "photo.webp, image/webp",
            "funny.gif, image/gif",
            "IMG_0001.HEIC, ''",
            "IMG_0002.heic, application/octet-stream",
            "clip.mp4, video/mp4",
            "clip.webm, video/webm",
            "clip.mov, ''"
    })
    @DisplayName("Should accept supported photo and video formats")
    void validate_SupportedFormats_Accepted(String name, String contentType) {
        assertThat(policy.validate(sized(name, contentType, 1024))).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "notes.txt, text/plain",
            "doc.pdf, application/pdf",
            "archive, ''"
    })
    @DisplayName("Should reject anything that is neither photo nor video")
    void validate_UnsupportedFormats_Rejected(String name, String contentType) {
        assertThat(policy.validate(sized(name, contentType, 1024)))
                .contains(MediaValidationPolicy.UNSUPPORTED_FORMAT);
    }

    @Test
    @DisplayName("Should reject a photo over the photo limit")
    void validate_PhotoTooLarge_Rejected() {
        assertThat(policy.validate(sized("big.jpg", "image/jpeg", 15 * MB + 1)))
                .contains("Photos must be less than 15MB");
    }

    @Test
    @DisplayName("Should accept a photo exactly at the limit")
    void validate_PhotoAtLimit_Accepted() {
        assertThat(policy.validate(sized("big.jpg", "image/jpeg", 15 * MB))).isEmpty();
    }

    @Test
    @DisplayName("Should apply the video limit to videos, not the photo limit")
    void validate_VideoLimits() {
        assertThat(policy.validate(sized("clip.mp4", "video/mp4", 40 * MB))).isEmpty();
        assertThat(policy.validate(sized("clip.mp4", "video/mp4", 50 * MB + 1)))
                .contains("Videos must be less than 50MB");
    }

    /**
     * Reports a size without allocating it.
     */
    private static MediaSource sized(String name, String contentType, long size) {
        return new InMemoryMediaSource(name, contentType, new byte[0]) {
            @Override
            public long getSizeBytes() {
                return size;
            }

            @Override
            public InputStream openStream() {
                return InputStream.nullInputStream();
            }
        };
    }
}
