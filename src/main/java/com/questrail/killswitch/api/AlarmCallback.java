package com.questrail.killswitch.api;

/**
 * Receives alarm records delivered by an {@link AlarmBus} subscription.
 *
 * <p>Invocations for one subscription are serialized and arrive in sequence
 * order. A callback that throws terminates its own subscription.</p>
 */
@FunctionalInterface
public interface AlarmCallback
{
    void onAlarm(AlarmRecord record);
}
