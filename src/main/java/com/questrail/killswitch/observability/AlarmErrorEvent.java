package com.questrail.killswitch.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the alarm stack.
 */
public record AlarmErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
