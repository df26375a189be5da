package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmBus;
import com.questrail.killswitch.api.AlarmRecord;

import java.util.Map;
import java.util.Objects;

/**
 * AlarmBroadcaster
 * -----------------------------------------------------------------------------
 * Name-bound handle used by fault producers to raise or clear one alarm.
 *
 * <p>Every call is a broadcast. Raising an alarm that is already raised is
 * legal and still advances the alarm's sequence; callers must not expect a
 * repeated call to be skipped.</p>
 *
 * <p>Thread-safe: all state lives on the bus.</p>
 */
public final class AlarmBroadcaster
{
    private final AlarmBus bus;
    private final String alarmName;
    private final String identity;

    public AlarmBroadcaster(AlarmBus bus, String alarmName, String identity) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.alarmName = Objects.requireNonNull(alarmName, "alarmName");
        this.identity = Objects.requireNonNull(identity, "identity");
        if (alarmName.isBlank()) {
            throw new IllegalArgumentException("alarmName must be non-blank");
        }
    }

    public String alarmName() {
        return alarmName;
    }

    public String identity() {
        return identity;
    }

    public AlarmRecord raiseAlarm() {
        return raiseAlarm(null, Map.of(), 0);
    }

    public AlarmRecord raiseAlarm(String problemDescription, Map<String, String> parameters) {
        return raiseAlarm(problemDescription, parameters, 0);
    }

    public AlarmRecord raiseAlarm(String problemDescription, Map<String, String> parameters, int severity) {
        return bus.broadcast(alarmName, true, problemDescription, parameters, identity, severity);
    }

    public AlarmRecord clearAlarm() {
        return clearAlarm(Map.of());
    }

    public AlarmRecord clearAlarm(Map<String, String> parameters) {
        return bus.broadcast(alarmName, false, null, parameters, identity, 0);
    }

    /**
     * Current record of the bound alarm.
     */
    public AlarmRecord current() {
        return bus.getOrCreate(alarmName);
    }
}
