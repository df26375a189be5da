package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmBus;
import com.questrail.killswitch.api.AlarmCallback;
import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.api.AlarmSubscription;

import java.util.Objects;
import java.util.Optional;

/**
 * AlarmListener
 * -----------------------------------------------------------------------------
 * Name-bound handle used by consumers to follow one alarm.
 *
 * <p>The constructor subscribes; by the time it returns the callback has
 * already received the alarm's current record on the constructing thread.
 * Afterwards the callback receives exactly one invocation per broadcast, in
 * sequence order, on the listener's dispatch thread.</p>
 *
 * <p>{@link #current()} is updated before the callback runs, so it is safe to
 * poll from other threads.</p>
 */
public final class AlarmListener implements AutoCloseable
{
    private final AlarmSubscription subscription;
    private volatile AlarmRecord current;

    public AlarmListener(AlarmBus bus, String alarmName, AlarmCallback callback) {
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(callback, "callback");

        this.subscription = bus.subscribe(alarmName, record -> {
            current = record;
            callback.onAlarm(record);
        });
    }

    /**
     * Listener that only tracks the current record.
     */
    public AlarmListener(AlarmBus bus, String alarmName) {
        this(bus, alarmName, record -> { });
    }

    public String alarmName() {
        return subscription.alarmName();
    }

    /**
     * Last record delivered to this listener.
     */
    public AlarmRecord current() {
        return current;
    }

    public boolean isRaised() {
        return current.raised();
    }

    public boolean isActive() {
        return subscription.isActive();
    }

    public Optional<Throwable> failure() {
        return subscription.failure();
    }

    @Override
    public void close() {
        subscription.close();
    }
}
