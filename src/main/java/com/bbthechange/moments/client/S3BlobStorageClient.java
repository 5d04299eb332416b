package com.bbthechange.moments.client;

import com.bbthechange.moments.config.StorageProperties;
import com.bbthechange.moments.exception.MediaTransferException;
import com.bbthechange.moments.upload.media.MediaSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.io.InputStream;

@Component
@Slf4j
public class S3BlobStorageClient implements BlobStorageClient {

    static final String CACHE_CONTROL = "max-age=3600";

    private final S3Client s3Client;
    private final StorageProperties properties;

    public S3BlobStorageClient(S3Client s3Client, StorageProperties properties) {
        this.s3Client = s3Client;
        this.properties = properties;
    }

    @Override
    public String upload(String key, MediaSource source, String contentType) {
        log.info("Uploading {} ({} bytes) to bucket {} as {}", source.getName(), source.getSizeBytes(),
                properties.getBucket(), key);

        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(properties.getBucket())
                .key(key)
                .contentType(contentType)
                .contentLength(source.getSizeBytes())
                .cacheControl(CACHE_CONTROL)
                .build();

        try (InputStream in = source.openStream()) {
            s3Client.putObject(request, RequestBody.fromInputStream(in, source.getSizeBytes()));
        } catch (IOException e) {
            log.error("Could not read {} for upload: {}", source.getName(), e.getMessage(), e);
            throw new MediaTransferException("Failed to read " + source.getName(), e);
        } catch (SdkException e) {
            log.error("Error uploading {} to S3: {}", key, e.getMessage(), e);
            throw new MediaTransferException("Failed to upload " + source.getName(), e);
        }

        return publicUrl(key);
    }

    @Override
    public String publicUrl(String key) {
        String base = properties.getPublicBaseUrl();
        if (base == null || base.isEmpty()) {
            return "/" + key;
        }
        return base.endsWith("/") ? base + key : base + "/" + key;
    }

    @Override
    public String getBucket() {
        return properties.getBucket();
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(properties.getBucket())
                    .key(key)
                    .build());
            log.info("Deleted object {} from bucket {}", key, properties.getBucket());
        } catch (SdkException e) {
            log.error("Error deleting {} from S3: {}", key, e.getMessage(), e);
            throw new MediaTransferException("Failed to delete " + key, e);
        }
    }
}
