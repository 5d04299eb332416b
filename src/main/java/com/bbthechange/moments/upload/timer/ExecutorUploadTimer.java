package com.bbthechange.moments.upload.timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link UploadTimer} backed by a single-thread scheduled executor. The one thread is the batch's
 * mailbox; a task that throws is logged and never kills it.
 */
public class ExecutorUploadTimer implements UploadTimer {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorUploadTimer.class);

    private final ScheduledExecutorService executor;
    private final String name;

    public ExecutorUploadTimer(String name) {
        this.name = name;
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor = scheduler;
    }

    @Override
    public boolean execute(Runnable task) {
        try {
            executor.execute(guarded(task));
            return true;
        } catch (RejectedExecutionException e) {
            logger.debug("Timer {} is shut down, dropping task", name);
            return false;
        }
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        try {
            return new FutureHandle(executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            logger.debug("Timer {} is shut down, dropping scheduled task", name);
            return FutureHandle.CANCELLED;
        }
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Runnable task, Duration period) {
        long millis = period.toMillis();
        try {
            return new FutureHandle(executor.scheduleAtFixedRate(guarded(task), millis, millis, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            logger.debug("Timer {} is shut down, dropping periodic task", name);
            return FutureHandle.CANCELLED;
        }
    }

    @Override
    public void shutdown() {
        executor.shutdown();
        logger.debug("Timer {} shut down", name);
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Task on timer {} failed", name, e);
            }
        };
    }

    private static final class FutureHandle implements TimerHandle {

        static final TimerHandle CANCELLED = new TimerHandle() {
            @Override
            public void cancel() {
                // never scheduled
            }

            @Override
            public boolean isCancelled() {
                return true;
            }
        };

        private final ScheduledFuture<?> future;

        FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
