package com.bbthechange.moments.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "moments.storage")
public class StorageProperties {

    private String bucket = "event-moments";

    /**
     * Base of the public URL objects are served from, without trailing slash.
     */
    private String publicBaseUrl = "";

    /**
     * Base URL of the server-side photo conversion endpoint; empty disables server conversion.
     */
    private String conversionBaseUrl = "";

    /**
     * Upper bound for one object upload attempt. Videos up to the size limit must fit in it.
     */
    private Duration uploadAttemptTimeout = Duration.ofMinutes(5);

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getPublicBaseUrl() {
        return publicBaseUrl;
    }

    public void setPublicBaseUrl(String publicBaseUrl) {
        this.publicBaseUrl = publicBaseUrl;
    }

    public String getConversionBaseUrl() {
        return conversionBaseUrl;
    }

    public void setConversionBaseUrl(String conversionBaseUrl) {
        this.conversionBaseUrl = conversionBaseUrl;
    }

    public Duration getUploadAttemptTimeout() {
        return uploadAttemptTimeout;
    }

    public void setUploadAttemptTimeout(Duration uploadAttemptTimeout) {
        this.uploadAttemptTimeout = uploadAttemptTimeout;
    }
}
