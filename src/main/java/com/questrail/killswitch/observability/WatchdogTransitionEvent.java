package com.questrail.killswitch.observability;

import com.questrail.killswitch.watchdog.WatchdogState;

import java.time.Duration;
import java.time.Instant;

/**
 * Record representing a heartbeat watchdog state transition.
 *
 * @param silence time since the last accepted signal (or since start when none arrived)
 */
public record WatchdogTransitionEvent(
    Instant timestamp,
    String alarmName,
    WatchdogState oldState,
    WatchdogState newState,
    Duration silence
) {
}
