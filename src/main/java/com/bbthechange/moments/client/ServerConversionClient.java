package com.bbthechange.moments.client;

import com.bbthechange.moments.config.StorageProperties;
import com.bbthechange.moments.exception.MediaTransferException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Asks the platform's conversion endpoint to turn an uploaded proprietary photo container into a
 * JPEG next to it, and returns the converted object's URL.
 */
@Component
public class ServerConversionClient {

    private static final Logger logger = LoggerFactory.getLogger(ServerConversionClient.class);
    private static final Duration CONVERSION_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final StorageProperties properties;

    @Autowired
    public ServerConversionClient(HttpClient mediaHttpClient, ObjectMapper objectMapper, StorageProperties properties) {
        this.httpClient = mediaHttpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public boolean isEnabled() {
        return properties.getConversionBaseUrl() != null && !properties.getConversionBaseUrl().isEmpty();
    }

    /**
     * Convert the object stored under {@code key}.
     *
     * @return URL of the converted JPEG
     * @throws MediaTransferException if the endpoint is unreachable or answers with an error
     */
    public String convert(String bucket, String key) {
        if (!isEnabled()) {
            throw new MediaTransferException("Server-side conversion is not configured");
        }
        String url = properties.getConversionBaseUrl() + "/convert-heic";
        try {
            String body = objectMapper.writeValueAsString(Map.of("bucket", bucket, "path", key));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .timeout(CONVERSION_TIMEOUT)
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int statusCode = response.statusCode();
            if (statusCode < 200 || statusCode >= 300) {
                logger.warn("Conversion of {} failed with status {}: {}", key, statusCode, response.body());
                throw new MediaTransferException("Server conversion returned status " + statusCode);
            }

            JsonNode json = objectMapper.readTree(response.body());
            JsonNode convertedUrl = json.get("url");
            if (convertedUrl == null || convertedUrl.asText().isEmpty()) {
                throw new MediaTransferException("Server conversion returned no URL for " + key);
            }
            logger.info("Converted {} server-side", key);
            return convertedUrl.asText();

        } catch (JsonProcessingException e) {
            throw new MediaTransferException("Unreadable conversion response for " + key, e);
        } catch (IOException e) {
            throw new MediaTransferException("Server conversion unreachable", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaTransferException("Interrupted during server conversion", e);
        }
    }
}
