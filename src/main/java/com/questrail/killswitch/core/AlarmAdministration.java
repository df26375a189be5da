package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmBus;
import com.questrail.killswitch.api.AlarmRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * AlarmAdministration
 * -----------------------------------------------------------------------------
 * Privileged operations on the alarm bus.
 *
 * <p>{@link #forceClear(String, String)} clears an alarm unconditionally, tagged
 * with {@code raisedBy = "manual-override"}. It takes the same path as any other
 * clear and leaves every watchdog's state untouched. A watchdog that is still
 * timed out raises its alarm again on its next tick; one that detects a new
 * timeout later raises it then.</p>
 */
public final class AlarmAdministration
{
    private static final Logger log = LoggerFactory.getLogger(AlarmAdministration.class);

    private final AlarmBus bus;

    public AlarmAdministration(AlarmBus bus) {
        this.bus = Objects.requireNonNull(bus, "bus");
    }

    public AlarmRecord forceClear(String alarmName) {
        return forceClear(alarmName, "operator request");
    }

    public AlarmRecord forceClear(String alarmName, String reason) {
        Objects.requireNonNull(reason, "reason");

        AlarmRecord before = bus.getOrCreate(alarmName);
        log.warn("Force-clearing alarm {} (raised={}, seq {}): {}",
                alarmName, before.raised(), before.sequence(), reason);

        return bus.broadcast(alarmName, false, null, Map.of("reason", reason), AlarmNames.MANUAL_OVERRIDE, 0);
    }
}
