package com.example.hotbox.timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cancellable, reschedulable delayed callbacks keyed by (key, kind).
 *
 * <p>Starting a timer replaces the one already registered for the same slot. A timer that was
 * superseded or cancelled never runs its callback, even if the scheduler already picked it up.
 * Callback failures are logged here and never reach the scheduler thread.</p>
 */
public class TimerManager {

    private static final Logger log = LoggerFactory.getLogger(TimerManager.class);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private final Map<Slot, Pending> timers = new ConcurrentHashMap<>();

    /** Uses a private daemon scheduler that is shut down with {@link #shutdown()}. */
    public TimerManager() {
        this(newDaemonScheduler("presence-timers"), true);
    }

    /** Uses a caller-owned scheduler (tests drive it with virtual time). */
    public TimerManager(ScheduledExecutorService scheduler) {
        this(scheduler, false);
    }

    private TimerManager(ScheduledExecutorService scheduler, boolean ownsScheduler) {
        if (scheduler == null) throw new IllegalArgumentException("scheduler must not be null");
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Cancels any timer for (key, kind) and schedules {@code callback} after {@code delay}.
     * Negative or null delays fire as soon as possible.
     */
    public void start(String key, TimerKind kind, Duration delay, Runnable callback) {
        if (key == null || kind == null || callback == null) {
            log.warn("Timer start ignored (key={}, kind={}, callback={})", key, kind, callback != null);
            return;
        }
        long delayMs = (delay == null) ? 0L : Math.max(0L, delay.toMillis());

        Slot slot = new Slot(key, kind);
        Pending pending = new Pending(slot, callback);
        Pending prev = timers.put(slot, pending);
        if (prev != null) prev.cancel();

        try {
            pending.future = scheduler.schedule(pending, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            timers.remove(slot, pending);
            log.warn("Timer rejected (key={}, kind={}): scheduler is shut down", key, kind);
            return;
        }
        log.debug("Timer started (key={}, kind={}, delayMs={})", key, kind, delayMs);
    }

    /** Idempotent. Returns true only if a pending timer was actually cancelled. */
    public boolean cancel(String key, TimerKind kind) {
        if (key == null || kind == null) return false;
        Pending pending = timers.remove(new Slot(key, kind));
        if (pending == null) return false;
        pending.cancel();
        log.debug("Timer cancelled (key={}, kind={})", key, kind);
        return true;
    }

    /** Cancels every kind of timer registered for {@code key}. */
    public void cancelAll(String key) {
        for (TimerKind kind : TimerKind.values()) cancel(key, kind);
    }

    public boolean isScheduled(String key, TimerKind kind) {
        if (key == null || kind == null) return false;
        return timers.containsKey(new Slot(key, kind));
    }

    public int pendingCount() {
        return timers.size();
    }

    public void shutdown() {
        List<Pending> all = new ArrayList<>(timers.values());
        timers.clear();
        for (Pending p : all) p.cancel();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
        log.info("TimerManager shut down ({} pending timers cancelled)", all.size());
    }

    private static ScheduledExecutorService newDaemonScheduler(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private record Slot(String key, TimerKind kind) { }

    private final class Pending implements Runnable {
        private final Slot slot;
        private final Runnable callback;
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;

        private Pending(Slot slot, Runnable callback) {
            this.slot = slot;
            this.callback = callback;
        }

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }

        @Override
        public void run() {
            if (cancelled) return;
            // only the current timer of its slot may fire
            if (!timers.remove(slot, this)) return;
            try {
                callback.run();
            } catch (Throwable t) {
                log.error("Timer callback failed (key={}, kind={})", slot.key(), slot.kind(), t);
            }
        }
    }
}
