package com.questrail.killswitch.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to stamp {@code AlarmRecord#observedAt()}.
 *
 * <p>
 * This clock may jump. It MUST NOT be used for heartbeat deadlines.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
