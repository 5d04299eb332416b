package com.bbthechange.moments.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pool for the blocking work of every batch (hashing, conversion, transfers, record store
 * calls). Batches never block their own mailbox thread.
 */
@Configuration
public class UploadExecutorConfig {

    private final MediaUploadProperties properties;

    public UploadExecutorConfig(MediaUploadProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "uploadIoExecutor", destroyMethod = "shutdown")
    public ExecutorService uploadIoExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "moments-upload-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getIoThreads(), threadFactory);
    }

    @Bean
    public HttpClient mediaHttpClient(StreamingProperties streamingProperties) {
        return HttpClient.newBuilder()
                .connectTimeout(streamingProperties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
