package com.questrail.killswitch.observability;

/**
 * No-op implementation of AlarmObservabilitySink.
 */
public final class NullObservabilitySink implements AlarmObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onAlarmBroadcast(AlarmBroadcastEvent event) {}

    @Override
    public void onWatchdogTransition(WatchdogTransitionEvent event) {}

    @Override
    public void onError(AlarmErrorEvent event) {}
}
