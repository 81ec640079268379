package com.openforge.clusterlens.stream;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Rate-limits a stream of values to at most one delivery per window.
 *
 *   emit(v), window elapsed   → deliver now, restart the window
 *   emit(v), inside window    → keep v as pending, (re)arm one timer for the rest of the window
 *   timer fires               → deliver the latest pending value, restart the window
 *   close()                   → cancel the timer, drop pending, ignore later emits
 *
 * Values emitted inside one window coalesce to the last one. All state is
 * guarded by the instance lock; the consumer runs while the lock is held so
 * deliveries are strictly ordered.
 */
@Slf4j
public class PhaseThrottler<T> {

    private final long                     windowMillis;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier             clock;
    private final Consumer<T>              consumer;

    private long               lastEmitAt = Long.MIN_VALUE;
    private T                  pending;
    private ScheduledFuture<?> timer;
    private boolean            closed;

    /**
     * @param clock milliseconds, monotonic; derived from {@code System.nanoTime()} in production
     */
    public PhaseThrottler(Duration window,
                          ScheduledExecutorService scheduler,
                          LongSupplier clock,
                          Consumer<T> consumer) {
        this.windowMillis = window.toMillis();
        this.scheduler    = scheduler;
        this.clock        = clock;
        this.consumer     = consumer;
    }

    public synchronized void emit(T value) {
        if (closed) {
            return;
        }
        long now = clock.getAsLong();
        long elapsed = lastEmitAt == Long.MIN_VALUE ? Long.MAX_VALUE : now - lastEmitAt;

        if (elapsed >= windowMillis) {
            cancelTimer();
            pending = null;
            deliver(value, now);
            return;
        }

        pending = value;
        cancelTimer();
        long remaining = windowMillis - elapsed;
        timer = scheduler.schedule(this::flush, remaining, TimeUnit.MILLISECONDS);
    }

    /** Cancels the pending timer; nothing is delivered after this returns. */
    public synchronized void close() {
        closed = true;
        pending = null;
        cancelTimer();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private synchronized void flush() {
        timer = null;
        if (closed || pending == null) {
            return;
        }
        T value = pending;
        pending = null;
        deliver(value, clock.getAsLong());
    }

    private void deliver(T value, long now) {
        lastEmitAt = now;
        try {
            consumer.accept(value);
        } catch (RuntimeException e) {
            log.warn("[PhaseThrottler] Consumer failed: {}", e.getMessage());
        }
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }
}
