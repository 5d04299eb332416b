package com.bbthechange.moments.upload;

import com.bbthechange.moments.config.MediaUploadProperties;

import java.time.Duration;
import java.util.List;

/**
 * Per-batch scheduling parameters.
 */
public record UploadSettings(
        int concurrencyLimit,
        int maxRetries,
        List<Duration> retryDelays,
        Duration staggerDelay,
        Duration watchdogInterval
) {

    public static UploadSettings from(MediaUploadProperties properties) {
        return new UploadSettings(
                properties.getConcurrencyLimit(),
                properties.getMaxRetries(),
                properties.getRetryDelays(),
                properties.getStaggerDelay(),
                properties.getWatchdogInterval());
    }
}
