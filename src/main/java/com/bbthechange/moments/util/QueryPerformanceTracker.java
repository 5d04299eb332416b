package com.bbthechange.moments.util;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Times DynamoDB calls of the record store. Slow calls are logged, every call is recorded in
 * the {@code dynamodb.query.duration} timer.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a record store call under the timer.
     *
     * @param operation DynamoDB operation name, used as metric tag
     * @param table table the call targets
     * @param queryOperation the call itself
     * @return whatever the call returns
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB call: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB call completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }

            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            logger.error("DynamoDB call failed: operation={}, table={}, duration={}ms, error={}",
                operation, table, duration, e.getMessage());
            throw e;

        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .register(meterRegistry));
        }
    }
}
