package com.questrail.killswitch.time;

import java.time.Instant;

/**
 * Production {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p><strong>Do not use for liveness decisions.</strong> Observability and
 * record timestamps only.</p>
 */
public enum SystemWallClock implements WallClock {
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
