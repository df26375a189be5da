package com.questrail.killswitch.watchdog;

import com.questrail.killswitch.core.AlarmBroadcaster;
import com.questrail.killswitch.observability.AlarmObservabilitySink;
import com.questrail.killswitch.time.MonotonicClock;
import com.questrail.killswitch.time.MonotonicScheduler;
import com.questrail.killswitch.time.WallClock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * NetworkLossWatchdog
 * -----------------------------------------------------------------------------
 * {@link HeartbeatWatchdog} over a message stream: every inbound message is a
 * liveness signal, whatever it carries.
 *
 * <p>Streams can be far faster than the tick interval, so while {@code ALIVE}
 * at most one message per tick interval is forwarded to {@link #onSignal()}.
 * Every message still stamps its arrival time in a lock-free field, and that
 * time is folded into the last-seen time before each tick evaluates silence.
 * Detection therefore sees the newest message exactly as if none had been
 * skipped. Messages that arrive while not {@code ALIVE} are always forwarded so
 * recovery is never delayed.</p>
 */
public class NetworkLossWatchdog extends HeartbeatWatchdog
{
    private static final long NONE = Long.MIN_VALUE;

    private final long coalesceNanos;
    private final AtomicLong lastForwardedNanos;
    private final AtomicLong latestMessageNanos = new AtomicLong(NONE);

    public NetworkLossWatchdog(AlarmBroadcaster broadcaster,
                               WatchdogTimingPolicy timingPolicy,
                               MonotonicClock clock,
                               MonotonicScheduler scheduler,
                               WallClock wallClock,
                               AlarmObservabilitySink observabilitySink)
    {
        super(broadcaster, timingPolicy, clock, scheduler, wallClock, observabilitySink);
        this.coalesceNanos = timingPolicy.tickInterval().toNanos();
        this.lastForwardedNanos = new AtomicLong(clock.nowNanos() - coalesceNanos);
    }

    /**
     * Accepts one message from the monitored stream. The payload is ignored.
     */
    public void onMessage(Object message) {
        long now = clock().nowNanos();
        latestMessageNanos.accumulateAndGet(now, Math::max);

        if (state() == WatchdogState.ALIVE) {
            long last = lastForwardedNanos.get();
            if (now - last < coalesceNanos) {
                return;
            }
            if (!lastForwardedNanos.compareAndSet(last, now)) {
                // Another producer forwarded this tick's signal.
                return;
            }
        } else {
            lastForwardedNanos.set(now);
        }

        onSignal();
    }

    @Override
    public void onTick() {
        // Only the tick moves ALIVE to TIMED_OUT, so this stays a plain stamp.
        long latest = latestMessageNanos.get();
        if (latest != NONE && state() == WatchdogState.ALIVE) {
            onSignalAt(latest);
        }
        super.onTick();
    }
}
