package com.questrail.killswitch.config;

import java.time.Duration;
import java.util.Objects;

/**
 * AlarmBusConfig
 * -----------------------------------------------------------------------------
 * Delivery configuration for {@code DefaultAlarmBus}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>deliveryQueueCapacity</b> — Records buffered per listener before a
 *       broadcaster blocks.</li>
 *   <li><b>deliveryTimeout</b> — Longest a broadcaster blocks on one full
 *       listener queue. A listener that stays full past this bound is
 *       terminated as failed; its transition is never silently dropped while it
 *       remains subscribed.</li>
 *   <li><b>listenerShutdownTimeout</b> — How long {@code close()} waits for an
 *       in-flight callback to return. After that it returns anyway; zero means
 *       it never waits.</li>
 * </ul>
 */
public record AlarmBusConfig(
        int deliveryQueueCapacity,
        Duration deliveryTimeout,
        Duration listenerShutdownTimeout
) {
    public AlarmBusConfig {
        Objects.requireNonNull(deliveryTimeout, "deliveryTimeout");
        Objects.requireNonNull(listenerShutdownTimeout, "listenerShutdownTimeout");

        if (deliveryQueueCapacity <= 0) {
            throw new IllegalArgumentException("deliveryQueueCapacity must be positive");
        }
        if (deliveryTimeout.isNegative() || deliveryTimeout.isZero()) {
            throw new IllegalArgumentException("deliveryTimeout must be positive");
        }
        if (listenerShutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("listenerShutdownTimeout must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>deliveryQueueCapacity: 64</li>
     *   <li>deliveryTimeout: 5s</li>
     *   <li>listenerShutdownTimeout: 5s</li>
     * </ul>
     */
    public static AlarmBusConfig defaults() {
        return new AlarmBusConfig(64, Duration.ofSeconds(5), Duration.ofSeconds(5));
    }
}
