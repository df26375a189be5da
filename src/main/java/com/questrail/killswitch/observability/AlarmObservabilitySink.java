package com.questrail.killswitch.observability;

/**
 * Main interface for receiving alarm stack observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface AlarmObservabilitySink {
    /**
     * Called after every broadcast has been stored on the bus.
     * @param event previous and current record
     */
    void onAlarmBroadcast(AlarmBroadcastEvent event);

    /**
     * Called when a heartbeat watchdog changes state.
     * @param event the transition details
     */
    void onWatchdogTransition(WatchdogTransitionEvent event);

    /**
     * Called when a listener fails, a record cannot be sent, or a timer task throws.
     * @param event the error event
     */
    void onError(AlarmErrorEvent event);
}
