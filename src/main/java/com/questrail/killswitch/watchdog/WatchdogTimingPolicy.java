package com.questrail.killswitch.watchdog;

import java.time.Duration;
import java.util.Objects;

/**
 * WatchdogTimingPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for a {@link HeartbeatWatchdog}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>deadline</b> — Longest silence tolerated before the watchdog times
 *       out. A silence strictly longer than this raises the alarm.</li>
 *   <li><b>tickInterval</b> — Period at which silence is re-evaluated. Detection
 *       happens at most one tick after the deadline passes; keep this at or
 *       below a quarter of the deadline.</li>
 *   <li><b>silentStartRaises</b> — Whether a source that never sends its first
 *       signal within the deadline of {@code start()} times out. Enabled by
 *       default: a vehicle that boots without a shore link is treated as
 *       having lost it.</li>
 * </ul>
 *
 * <p>Non-positive durations are rejected here, at construction; there is no
 * fallback value.</p>
 */
public record WatchdogTimingPolicy(
        Duration deadline,
        Duration tickInterval,
        boolean silentStartRaises
) {
    public WatchdogTimingPolicy {
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(tickInterval, "tickInterval");

        if (deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("deadline must be positive: " + deadline);
        }
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive: " + tickInterval);
        }
    }

    public static WatchdogTimingPolicy of(Duration deadline, Duration tickInterval) {
        return new WatchdogTimingPolicy(deadline, tickInterval, true);
    }

    /**
     * Default values match the shore network heartbeat:
     * <ul>
     *   <li>deadline: 8s</li>
     *   <li>tickInterval: 500ms</li>
     *   <li>silentStartRaises: true</li>
     * </ul>
     */
    public static WatchdogTimingPolicy defaults() {
        return new WatchdogTimingPolicy(Duration.ofSeconds(8), Duration.ofMillis(500), true);
    }

    /**
     * Whether the tick interval is within the recommended quarter of the deadline.
     */
    public boolean hasBoundedDetectionLatency() {
        return tickInterval.multipliedBy(4).compareTo(deadline) <= 0;
    }

    public WatchdogTimingPolicy withSilentStartRaises(boolean raises) {
        return new WatchdogTimingPolicy(deadline, tickInterval, raises);
    }
}
