package com.questrail.killswitch.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for liveness decisions.
 *
 * <h2>Binding invariant</h2>
 * Every heartbeat deadline comparison MUST use a monotonic time source. A
 * wall-clock jump (NTP step, manual adjustment) must never raise or clear a
 * kill alarm. Wall-clock time is used only to stamp {@code observedAt} on
 * alarm records.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
