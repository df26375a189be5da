package com.questrail.killswitch.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the supplied {@link MonotonicClock}. The same clock instance must be used
 * by callers computing deadlines, typically {@link SystemMonotonicClock#INSTANCE}.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>The executor is <strong>not</strong> owned here. Whoever created it shuts
 * it down (see {@code KillSwitchRuntime#stop()}).</p>
 *
 * <h2>Threading</h2>
 * <p>Watchdog ticks run on the executor's threads, never on the thread that
 * delivers liveness signals. A busy signal producer therefore cannot delay
 * timeout detection.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return new ScheduledFutureCancellable(future);
    }

    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // A tick that is already running is allowed to finish.
            return future.cancel(false);
        }
    }
}
