package com.questrail.killswitch.observability;

import com.questrail.killswitch.api.AlarmRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of AlarmObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jAlarmObservabilitySink implements AlarmObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAlarmObservabilitySink.class);

    @Override
    public void onAlarmBroadcast(AlarmBroadcastEvent event) {
        AlarmRecord current = event.current();
        if (!event.isTransition()) {
            log.debug("Alarm {} repeated: raised={} seq={} by {}",
                current.name(), current.raised(), current.sequence(), current.raisedBy());
            return;
        }

        if (current.raised()) {
            log.warn("Alarm {} RAISED by {} (seq {}): {} {}",
                current.name(),
                current.raisedBy(),
                current.sequence(),
                current.problem().orElse("no description"),
                current.parameters());
        } else {
            log.info("Alarm {} cleared by {} (seq {})",
                current.name(), current.raisedBy(), current.sequence());
        }
    }

    @Override
    public void onWatchdogTransition(WatchdogTransitionEvent event) {
        log.info("Watchdog {}: {} -> {} after {} ms of silence",
            event.alarmName(),
            event.oldState(),
            event.newState(),
            event.silence().toMillis());
    }

    @Override
    public void onError(AlarmErrorEvent event) {
        log.error("Alarm stack error: {}", event.message(), event.cause());
    }
}
