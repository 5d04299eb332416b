package com.bbthechange.moments.upload.timer;

import java.time.Duration;

/**
 * Mailbox and timer service of one batch. Every task submitted here runs on the same logical
 * thread, one at a time, so tasks can read and dispatch against the batch state without further
 * locking. Tests substitute a virtual-clock implementation.
 */
public interface UploadTimer {

    /**
     * Run the task on the mailbox as soon as possible, after tasks already queued.
     *
     * @return false when the timer is shut down and the task was dropped
     */
    boolean execute(Runnable task);

    TimerHandle schedule(Runnable task, Duration delay);

    TimerHandle scheduleAtFixedRate(Runnable task, Duration period);

    /**
     * Stop accepting tasks. Tasks already queued for immediate execution still run; delayed and
     * periodic tasks are dropped.
     */
    void shutdown();
}
