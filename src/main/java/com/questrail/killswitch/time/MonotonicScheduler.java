package com.questrail.killswitch.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * One-shot timer used to drive watchdog ticks.
 *
 * <p>Deadlines are monotonic nanoseconds from the same {@link MonotonicClock}
 * the watchdog reads, never wall-clock instants. There is no periodic
 * variant: a watchdog re-arms its next tick from inside the current one, at
 * the previous deadline plus the tick interval, so ticks do not drift when a
 * tick runs late.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Runs {@code task} once, at or after {@code deadlineNanos}. A deadline
     * already in the past runs as soon as possible.
     *
     * @return handle that cancels the task if it has not started
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Runs {@code task} once after {@code delay}, measured on {@code clock}.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0: " + delay);
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
