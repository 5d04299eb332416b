package com.bbthechange.moments.upload.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Backoff for retryable transfer failures: one delay per retry, the last delay repeating when
 * more retries than delays are allowed.
 */
public class RetryPolicy {

    private final int maxRetries;
    private final List<Duration> delays;

    public RetryPolicy(int maxRetries, List<Duration> delays) {
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("At least one retry delay is required");
        }
        this.maxRetries = maxRetries;
        this.delays = List.copyOf(delays);
    }

    /**
     * @param retriesSoFar retries already scheduled for the file
     * @return the delay before the next attempt, or empty when the budget is spent
     */
    public Optional<Duration> nextDelay(int retriesSoFar) {
        if (retriesSoFar >= maxRetries) {
            return Optional.empty();
        }
        return Optional.of(delays.get(Math.min(retriesSoFar, delays.size() - 1)));
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
