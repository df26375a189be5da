package com.questrail.killswitch.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a task submitted to a {@link MonotonicScheduler}.
 *
 * <p>
 * Watchdog timers hold one of these for the currently armed tick and cancel it
 * when the watchdog is closed.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
