package com.bbthechange.moments.upload;

import com.bbthechange.moments.upload.state.BatchStateStore;
import com.bbthechange.moments.upload.state.BatchStatus;
import com.bbthechange.moments.upload.state.BatchUploadState;
import com.bbthechange.moments.upload.timer.TimerHandle;
import com.bbthechange.moments.upload.timer.UploadTimer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Periodic check, while the batch is uploading, for queued work with nothing active and no pass
 * running. When it finds that state it forces a scheduling pass.
 */
public class StallWatchdog {

    private static final Logger logger = LoggerFactory.getLogger(StallWatchdog.class);

    private final BatchStateStore store;
    private final UploadScheduler scheduler;
    private final UploadTimer timer;
    private final Duration interval;
    private final MeterRegistry meterRegistry;

    private TimerHandle handle;

    public StallWatchdog(BatchStateStore store, UploadScheduler scheduler, UploadTimer timer,
                         Duration interval, MeterRegistry meterRegistry) {
        this.store = store;
        this.scheduler = scheduler;
        this.timer = timer;
        this.interval = interval;
        this.meterRegistry = meterRegistry;
    }

    public void start() {
        if (isRunning()) {
            return;
        }
        handle = timer.scheduleAtFixedRate(this::check, interval);
    }

    public void stop() {
        if (handle != null) {
            handle.cancel();
            handle = null;
        }
    }

    public boolean isRunning() {
        return handle != null && !handle.isCancelled();
    }

    void check() {
        BatchUploadState state = store.getState();
        if (state.getStatus() != BatchStatus.UPLOADING) {
            stop();
            return;
        }
        int queued = state.dispatchableQueuedIds().size();
        if (queued > 0 && state.activeCount() == 0 && !scheduler.isProcessing()) {
            logger.warn("Batch {} stalled with {} queued files and nothing active, restarting dispatch",
                    state.getBatchId(), queued);
            meterRegistry.counter("moments.upload.watchdog.restarts").increment();
            scheduler.runPass();
        }
    }
}
