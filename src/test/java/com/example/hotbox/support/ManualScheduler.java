package com.example.hotbox.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Virtual-time scheduler for timer tests. {@link #executor()} is a Mockito mock whose
 * {@code schedule(Runnable, long, TimeUnit)} only records the task; {@link #advance(Duration)}
 * moves the shared {@link MutableClock} and runs due tasks in due-time order.
 */
public class ManualScheduler {

    private final MutableClock clock;
    private final ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
    private final List<Task> tasks = new ArrayList<>();
    private long seq = 0L;

    public ManualScheduler(MutableClock clock) {
        this.clock = clock;
        when(executor.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(inv -> {
            Runnable r = inv.getArgument(0);
            long delay = inv.getArgument(1);
            TimeUnit unit = inv.getArgument(2);
            return add(r, unit.toMillis(delay));
        });
    }

    public ScheduledExecutorService executor() {
        return executor;
    }

    public MutableClock clock() {
        return clock;
    }

    private synchronized Task add(Runnable r, long delayMs) {
        Task t = new Task(r, clock.millis() + delayMs, seq++);
        tasks.add(t);
        return t;
    }

    /** Tasks neither run nor cancelled. */
    public synchronized int pendingTasks() {
        int n = 0;
        for (Task t : tasks) if (!t.cancelled && !t.done) n++;
        return n;
    }

    public void advance(Duration d) {
        long target = clock.millis() + d.toMillis();
        while (true) {
            Task next = nextDue(target);
            if (next == null) break;
            if (next.due > clock.millis()) clock.setMillis(next.due);
            next.done = true;
            next.runnable.run();
        }
        clock.setMillis(target);
    }

    private synchronized Task nextDue(long target) {
        Task best = tasks.stream()
                .filter(t -> !t.cancelled && !t.done && t.due <= target)
                .min(Comparator.comparingLong((Task t) -> t.due).thenComparingLong(t -> t.seq))
                .orElse(null);
        if (best != null) tasks.remove(best);
        return best;
    }

    private final class Task implements ScheduledFuture<Object> {
        final Runnable runnable;
        final long due;
        final long seq;
        volatile boolean cancelled;
        volatile boolean done;

        Task(Runnable runnable, long due, long seq) {
            this.runnable = runnable;
            this.due = due;
            this.seq = seq;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (cancelled || done) return false;
            cancelled = true;
            return true;
        }

        @Override public boolean isCancelled() { return cancelled; }
        @Override public boolean isDone() { return cancelled || done; }
        @Override public Object get() { return null; }
        @Override public Object get(long timeout, TimeUnit unit) { return null; }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(due - clock.millis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed o) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
        }
    }
}
