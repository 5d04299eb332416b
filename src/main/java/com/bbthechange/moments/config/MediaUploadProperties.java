package com.bbthechange.moments.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DataSizeUnit;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.util.unit.DataUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Tuning of the bulk upload orchestrator: concurrency, retry backoff, pacing and media limits.
 */
@Component
@ConfigurationProperties(prefix = "moments.upload")
public class MediaUploadProperties {

    private int concurrencyLimit = 2;

    private int maxRetries = 3;

    @DurationUnit(ChronoUnit.MILLIS)
    private List<Duration> retryDelays = new ArrayList<>(List.of(
            Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)));

    @DurationUnit(ChronoUnit.MILLIS)
    private Duration staggerDelay = Duration.ofMillis(200);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration watchdogInterval = Duration.ofSeconds(2);

    @DataSizeUnit(DataUnit.MEGABYTES)
    private DataSize photoMaxSize = DataSize.ofMegabytes(15);

    @DataSizeUnit(DataUnit.MEGABYTES)
    private DataSize videoMaxSize = DataSize.ofMegabytes(50);

    @DataSizeUnit(DataUnit.MEGABYTES)
    private DataSize compressionThreshold = DataSize.ofMegabytes(3);

    @DataSizeUnit(DataUnit.MEGABYTES)
    private DataSize compressionTargetSize = DataSize.ofMegabytes(2);

    private int maxImageDimension = 4096;

    private float compressionQuality = 0.85f;

    private int ioThreads = 8;

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public void setConcurrencyLimit(int concurrencyLimit) {
        this.concurrencyLimit = concurrencyLimit;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public List<Duration> getRetryDelays() {
        return retryDelays;
    }

    public void setRetryDelays(List<Duration> retryDelays) {
        this.retryDelays = retryDelays;
    }

    public Duration getStaggerDelay() {
        return staggerDelay;
    }

    public void setStaggerDelay(Duration staggerDelay) {
        this.staggerDelay = staggerDelay;
    }

    public Duration getWatchdogInterval() {
        return watchdogInterval;
    }

    public void setWatchdogInterval(Duration watchdogInterval) {
        this.watchdogInterval = watchdogInterval;
    }

    public DataSize getPhotoMaxSize() {
        return photoMaxSize;
    }

    public void setPhotoMaxSize(DataSize photoMaxSize) {
        this.photoMaxSize = photoMaxSize;
    }

    public DataSize getVideoMaxSize() {
        return videoMaxSize;
    }

    public void setVideoMaxSize(DataSize videoMaxSize) {
        this.videoMaxSize = videoMaxSize;
    }

    public DataSize getCompressionThreshold() {
        return compressionThreshold;
    }

    public void setCompressionThreshold(DataSize compressionThreshold) {
        this.compressionThreshold = compressionThreshold;
    }

    public DataSize getCompressionTargetSize() {
        return compressionTargetSize;
    }

    public void setCompressionTargetSize(DataSize compressionTargetSize) {
        this.compressionTargetSize = compressionTargetSize;
    }

    public int getMaxImageDimension() {
        return maxImageDimension;
    }

    public void setMaxImageDimension(int maxImageDimension) {
        this.maxImageDimension = maxImageDimension;
    }

    public float getCompressionQuality() {
        return compressionQuality;
    }

    public void setCompressionQuality(float compressionQuality) {
        this.compressionQuality = compressionQuality;
    }

    public int getIoThreads() {
        return ioThreads;
    }

    public void setIoThreads(int ioThreads) {
        this.ioThreads = ioThreads;
    }
}
