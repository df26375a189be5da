package com.questrail.killswitch.observability;

import com.questrail.killswitch.api.AlarmRecord;

/**
 * Record representing one broadcast on the alarm bus.
 */
public record AlarmBroadcastEvent(
    AlarmRecord previous,
    AlarmRecord current
) {
    /**
     * Checks if the raised flag changed with this broadcast.
     */
    public boolean isTransition() {
        return previous.raised() != current.raised();
    }
}
