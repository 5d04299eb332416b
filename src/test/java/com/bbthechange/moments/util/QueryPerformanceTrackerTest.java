package com.bbthechange.moments.util;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryPerformanceTrackerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final QueryPerformanceTracker tracker = new QueryPerformanceTracker(meterRegistry);

    @Test
    void trackQuery_ReturnsResultAndRecordsTimer() {
        String result = tracker.trackQuery("Query", "MomentsTable", () -> "ok");

        assertThat(result).isEqualTo("ok");
        Timer timer = meterRegistry.find("dynamodb.query.duration")
            .tag("operation", "Query").tag("table", "MomentsTable").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }

    @Test
    void trackQuery_RethrowsAndStillRecords() {
        assertThatThrownBy(() -> tracker.trackQuery("PutItem", "MomentsTable", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(meterRegistry.find("dynamodb.query.duration").tag("operation", "PutItem").timer().count())
            .isEqualTo(1);
    }
}
