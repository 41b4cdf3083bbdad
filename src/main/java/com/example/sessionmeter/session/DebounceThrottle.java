package com.example.sessionmeter.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Leading throttle combined with a trailing debounce.
 *
 * <p>Each {@link #debounce(Runnable)} call first drops any pending callback. If at least
 * {@code throttleDelay} has passed since the last execution the callback runs at once on the
 * calling thread; otherwise it is scheduled {@code debounceDelay} after this call. Under sustained
 * calls this gives at most one execution per throttle window, and the last call of a burst always
 * runs.
 *
 * <p>There is a single pending slot. A scheduled run that has been superseded never executes.
 */
public class DebounceThrottle {

    private static final Logger logger = LoggerFactory.getLogger(DebounceThrottle.class);

    private static final long NEVER = Long.MIN_VALUE;

    private final ScheduledExecutorService scheduler;
    private final long debounceDelayMs;
    private final long throttleDelayMs;
    private final Clock clock;

    private long lastExecuteTime = NEVER;
    private Pending pending;

    public DebounceThrottle(ScheduledExecutorService scheduler, Duration debounceDelay, Duration throttleDelay) {
        this(scheduler, debounceDelay, throttleDelay, Clock.systemUTC());
    }

    public DebounceThrottle(ScheduledExecutorService scheduler, Duration debounceDelay,
                            Duration throttleDelay, Clock clock) {
        if (debounceDelay.isNegative() || throttleDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        this.scheduler = scheduler;
        this.debounceDelayMs = debounceDelay.toMillis();
        this.throttleDelayMs = throttleDelay.toMillis();
        this.clock = clock;
    }

    public void debounce(Runnable callback) {
        Runnable runNow = null;
        synchronized (this) {
            long now = clock.millis();
            clearPending();
            if (lastExecuteTime == NEVER || now - lastExecuteTime >= throttleDelayMs) {
                lastExecuteTime = now;
                runNow = callback;
            } else {
                Pending next = new Pending(callback);
                next.future = scheduler.schedule(() -> runScheduled(next), debounceDelayMs, TimeUnit.MILLISECONDS);
                pending = next;
            }
        }
        if (runNow != null) {
            runNow.run();
        }
    }

    /**
     * Runs the pending callback now, if there is one.
     *
     * @return true if a callback ran
     */
    public boolean flush() {
        Runnable callback;
        synchronized (this) {
            if (pending == null) {
                return false;
            }
            callback = pending.callback;
            clearPending();
            lastExecuteTime = clock.millis();
        }
        callback.run();
        return true;
    }

    /**
     * Drops the pending callback without running it.
     */
    public synchronized void cancel() {
        clearPending();
    }

    public synchronized boolean hasPending() {
        return pending != null;
    }

    private void runScheduled(Pending scheduled) {
        synchronized (this) {
            if (pending != scheduled) {
                return;
            }
            pending = null;
            lastExecuteTime = clock.millis();
        }
        try {
            scheduled.callback.run();
        } catch (RuntimeException e) {
            logger.error("Debounced callback failed", e);
        }
    }

    private void clearPending() {
        if (pending != null) {
            if (pending.future != null) {
                pending.future.cancel(false);
            }
            pending = null;
        }
    }

    private static final class Pending {
        private final Runnable callback;
        private ScheduledFuture<?> future;

        private Pending(Runnable callback) {
            this.callback = callback;
        }
    }
}
