package com.bbthechange.moments.upload.timer;

/**
 * A pending or periodic task that can be cancelled. Cancelling an already fired one-shot task is
 * a no-op.
 */
public interface TimerHandle {

    void cancel();

    boolean isCancelled();
}
