package com.questrail.killswitch.watchdog;

/**
 * Liveness bookkeeping for one {@link HeartbeatWatchdog}.
 *
 * <p>Owned by exactly one watchdog and never shared. Every method is
 * synchronized on this object; the critical sections are a few field
 * reads and writes, never a broadcast.</p>
 */
final class HeartbeatSource
{
    /**
     * A state change decided by this source, to be published by the watchdog.
     *
     * @param silenceNanos silence that preceded the change
     */
    record Transition(WatchdogState from, WatchdogState to, long silenceNanos) {}

    private final long deadlineNanos;
    private final boolean silentStartRaises;

    private WatchdogState state = WatchdogState.AWAITING_FIRST;
    private long startedNanos;
    private long lastSeenNanos;
    private boolean seen;
    private long silenceBeforeLastSignalNanos;

    HeartbeatSource(long deadlineNanos, boolean silentStartRaises) {
        this.deadlineNanos = deadlineNanos;
        this.silentStartRaises = silentStartRaises;
    }

    synchronized void start(long nowNanos) {
        startedNanos = nowNanos;
    }

    synchronized WatchdogState state() {
        return state;
    }

    /**
     * Records a signal and returns the state it was observed in.
     */
    synchronized WatchdogState recordSignal(long nowNanos) {
        long reference = seen ? lastSeenNanos : startedNanos;
        silenceBeforeLastSignalNanos = Math.max(0L, nowNanos - reference);
        if (!seen || nowNanos - lastSeenNanos > 0) {
            lastSeenNanos = nowNanos;
        }
        seen = true;
        return state;
    }

    /**
     * Moves to {@link WatchdogState#ALIVE} if not already there.
     */
    synchronized Transition revive() {
        if (state == WatchdogState.ALIVE) {
            return null;
        }
        WatchdogState from = state;
        state = WatchdogState.ALIVE;
        return new Transition(from, WatchdogState.ALIVE, silenceBeforeLastSignalNanos);
    }

    /**
     * Moves to {@link WatchdogState#TIMED_OUT} if the silence at {@code nowNanos}
     * exceeds the deadline.
     */
    synchronized Transition expire(long nowNanos) {
        if (state == WatchdogState.TIMED_OUT) {
            return null;
        }
        if (state == WatchdogState.AWAITING_FIRST && !seen && !silentStartRaises) {
            return null;
        }

        long reference = seen ? lastSeenNanos : startedNanos;
        long silence = nowNanos - reference;
        if (silence <= deadlineNanos) {
            return null;
        }

        WatchdogState from = state;
        state = WatchdogState.TIMED_OUT;
        return new Transition(from, WatchdogState.TIMED_OUT, silence);
    }

    /**
     * Silence at {@code nowNanos}, measured from the last signal or, before
     * the first one, from {@code start}.
     */
    synchronized long silenceNanos(long nowNanos) {
        long reference = seen ? lastSeenNanos : startedNanos;
        return Math.max(0L, nowNanos - reference);
    }
}
