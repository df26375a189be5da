package com.questrail.killswitch.watchdog;

/**
 * States of a {@link HeartbeatWatchdog}. There is no terminal state; a
 * watchdog cycles between {@link #ALIVE} and {@link #TIMED_OUT} until closed.
 */
public enum WatchdogState
{
    /** Started, no signal accepted yet. */
    AWAITING_FIRST,

    /** Last signal is within the deadline. The bound alarm was cleared. */
    ALIVE,

    /** No signal for longer than the deadline. The bound alarm was raised. */
    TIMED_OUT
}
