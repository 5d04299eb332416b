package com.bbthechange.moments.upload;

import com.bbthechange.moments.upload.state.BatchStateStore;
import com.bbthechange.moments.upload.state.BatchStatus;
import com.bbthechange.moments.upload.state.BatchUploadState;
import com.bbthechange.moments.upload.state.FileStatus;
import com.bbthechange.moments.upload.timer.TimerHandle;
import com.bbthechange.moments.upload.timer.UploadTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * The only component that starts a file's pipeline.
 *
 * <p>A pass fills free concurrency slots with hashed, queued files in intake order, one start per
 * stagger interval. Every step re-reads the store, so a pause, removal or reset between steps is
 * honoured. While a pass is running further requests are coalesced into one follow-up pass.
 * All methods run on the batch's mailbox except {@link #requestPass()}.
 */
public class UploadScheduler {

    private static final Logger logger = LoggerFactory.getLogger(UploadScheduler.class);

    private final BatchStateStore store;
    private final UploadTimer timer;
    private final Duration staggerDelay;
    private final Consumer<String> starter;

    private boolean processing;
    private boolean passRequested;
    private TimerHandle pendingStep;

    public UploadScheduler(BatchStateStore store, UploadTimer timer, Duration staggerDelay, Consumer<String> starter) {
        this.store = store;
        this.timer = timer;
        this.staggerDelay = staggerDelay;
        this.starter = starter;
    }

    /**
     * Ask for a pass from any thread.
     */
    public void requestPass() {
        timer.execute(this::runPass);
    }

    /**
     * Start a pass now, or mark one as wanted when a pass is already in progress.
     */
    public void runPass() {
        if (processing) {
            passRequested = true;
            return;
        }
        processing = true;
        passRequested = false;
        step(true);
    }

    public boolean isProcessing() {
        return processing;
    }

    /**
     * Drop a staggered start that has not fired yet, ending the current pass.
     */
    public void cancel() {
        if (pendingStep != null) {
            pendingStep.cancel();
            pendingStep = null;
        }
        processing = false;
        passRequested = false;
    }

    private void step(boolean firstOfPass) {
        pendingStep = null;
        BatchUploadState state = store.getState();
        if (state.getStatus() != BatchStatus.UPLOADING) {
            finishPass();
            return;
        }
        int freeSlots = state.getConcurrencyLimit() - state.activeCount();
        List<String> queued = state.dispatchableQueuedIds();
        if (freeSlots <= 0 || queued.isEmpty()) {
            if (firstOfPass) {
                logger.trace("Nothing to dispatch in batch {} (free={}, queued={})",
                        state.getBatchId(), freeSlots, queued.size());
            }
            finishPass();
            return;
        }

        String fileId = queued.get(0);
        logger.debug("Dispatching {} in batch {} ({} free slots)", fileId, state.getBatchId(), freeSlots);
        starter.accept(fileId);

        BatchUploadState after = store.getState();
        if (after.file(fileId) != null && after.file(fileId).getStatus() == FileStatus.QUEUED) {
            logger.warn("File {} in batch {} did not start, ending pass", fileId, after.getBatchId());
            finishPass();
            return;
        }
        boolean moreWork = after.getStatus() == BatchStatus.UPLOADING
                && after.activeCount() < after.getConcurrencyLimit()
                && !after.dispatchableQueuedIds().isEmpty();
        if (moreWork) {
            pendingStep = timer.schedule(() -> step(false), staggerDelay);
        } else {
            finishPass();
        }
    }

    private void finishPass() {
        processing = false;
        if (passRequested) {
            passRequested = false;
            timer.execute(this::runPass);
        }
    }
}
