package com.bbthechange.moments.testutil;

import com.bbthechange.moments.upload.timer.TimerHandle;
import com.bbthechange.moments.upload.timer.UploadTimer;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.PriorityQueue;

/**
 * Single-threaded {@link UploadTimer} on a virtual clock. Nothing runs until the test calls
 * {@link #runReady()}, {@link #settle(ManualExecutor)} or {@link #advance(Duration, ManualExecutor)}.
 */
public class VirtualUploadTimer implements UploadTimer {

    private final Deque<Runnable> ready = new ArrayDeque<>();
    private final PriorityQueue<Scheduled> scheduled = new PriorityQueue<>();
    private long nowMillis;
    private long sequence;
    private boolean shutdown;

    @Override
    public boolean execute(Runnable task) {
        if (shutdown) {
            return false;
        }
        ready.add(task);
        return true;
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        return enqueue(task, delay.toMillis(), 0);
    }

    @Override
    public TimerHandle scheduleAtFixedRate(Runnable task, Duration period) {
        return enqueue(task, period.toMillis(), period.toMillis());
    }

    @Override
    public void shutdown() {
        shutdown = true;
        scheduled.forEach(Scheduled::cancel);
        scheduled.clear();
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public long nowMillis() {
        return nowMillis;
    }

    /**
     * Run every task posted for immediate execution, including tasks they post.
     */
    public int runReady() {
        int ran = 0;
        Runnable next;
        while ((next = ready.poll()) != null) {
            next.run();
            ran++;
        }
        return ran;
    }

    /**
     * Alternate between the mailbox and the I/O executor until both are idle. The clock does
     * not move.
     */
    public void settle(ManualExecutor io) {
        int ran;
        do {
            ran = runReady() + io.runAll();
        } while (ran > 0);
    }

    /**
     * Move the clock forward, firing due tasks in time order and settling after each.
     */
    public void advance(Duration duration, ManualExecutor io) {
        long target = nowMillis + duration.toMillis();
        settle(io);
        while (true) {
            Scheduled next = scheduled.peek();
            if (next == null || next.dueAt > target) {
                break;
            }
            scheduled.poll();
            if (next.cancelled) {
                continue;
            }
            nowMillis = next.dueAt;
            if (next.period > 0) {
                next.dueAt += next.period;
                next.seq = sequence++;
                scheduled.add(next);
            } else {
                next.fired = true;
            }
            next.task.run();
            settle(io);
        }
        nowMillis = target;
    }

    public int scheduledCount() {
        return (int) scheduled.stream().filter(s -> !s.cancelled).count();
    }

    private TimerHandle enqueue(Runnable task, long delayMillis, long periodMillis) {
        Scheduled entry = new Scheduled(task, nowMillis + delayMillis, periodMillis, sequence++);
        if (shutdown) {
            entry.cancel();
            return entry;
        }
        scheduled.add(entry);
        return entry;
    }

    private static final class Scheduled implements TimerHandle, Comparable<Scheduled> {
        private final Runnable task;
        private final long period;
        private long dueAt;
        private long seq;
        private boolean cancelled;
        private boolean fired;

        private Scheduled(Runnable task, long dueAt, long period, long seq) {
            this.task = task;
            this.dueAt = dueAt;
            this.period = period;
            this.seq = seq;
        }

        @Override
        public void cancel() {
            if (!fired) {
                cancelled = true;
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public int compareTo(Scheduled other) {
            int byTime = Long.compare(dueAt, other.dueAt);
            return byTime != 0 ? byTime : Long.compare(seq, other.seq);
        }
    }
}
