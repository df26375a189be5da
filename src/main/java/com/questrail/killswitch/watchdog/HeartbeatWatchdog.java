package com.questrail.killswitch.watchdog;

import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.core.AlarmBroadcaster;
import com.questrail.killswitch.observability.AlarmErrorEvent;
import com.questrail.killswitch.observability.AlarmObservabilitySink;
import com.questrail.killswitch.observability.NullObservabilitySink;
import com.questrail.killswitch.observability.WatchdogTransitionEvent;
import com.questrail.killswitch.time.Cancellable;
import com.questrail.killswitch.time.MonotonicClock;
import com.questrail.killswitch.time.MonotonicScheduler;
import com.questrail.killswitch.time.SystemWallClock;
import com.questrail.killswitch.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * HeartbeatWatchdog
 * =============================================================================
 * Turns "a periodic liveness signal stopped arriving" into a raised alarm, and
 * "it resumed" into a cleared one.
 *
 * <h2>State machine</h2>
 * <pre>
 *   AWAITING_FIRST --signal--> ALIVE        (clearAlarm)
 *   AWAITING_FIRST --tick, silence > D--> TIMED_OUT   (raiseAlarm, if silentStartRaises)
 *   ALIVE          --tick, silence > D--> TIMED_OUT   (raiseAlarm)
 *   TIMED_OUT      --signal--> ALIVE        (clearAlarm)
 *   ALIVE          --signal--> ALIVE        (no broadcast)
 *   TIMED_OUT      --tick, alarm cleared--> TIMED_OUT   (raiseAlarm again)
 * </pre>
 * While {@code TIMED_OUT} every tick checks the bound alarm. If something
 * else cleared it (a manual force-clear, say) the watchdog raises it again,
 * so a timed-out source is never reported healthy for longer than one tick.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>{@link #onSignal()} may be called from any number of producer threads.
 *       While {@code ALIVE} it only stamps the last-seen time under the
 *       source's monitor and never touches the bus.</li>
 *   <li>{@link #onTick()} runs on the scheduler's thread every tick interval,
 *       independent of producers, so a stalled producer cannot delay detection.</li>
 *   <li>State changes and their broadcasts are serialized by a transition lock:
 *       the bus sees raise and clear in the order the transitions happened.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   watchdog.start()   → arms the periodic tick, starts the silence clock
 *   watchdog.onSignal  → liveness
 *   watchdog.close()   → cancels the tick
 * </pre>
 * A producer that simply stops calling {@link #onSignal()} never cancels
 * anything; that silence is exactly what the watchdog reports.
 */
public class HeartbeatWatchdog implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(HeartbeatWatchdog.class);

    private final AlarmBroadcaster broadcaster;
    private final WatchdogTimingPolicy timingPolicy;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final AlarmObservabilitySink observabilitySink;

    private final HeartbeatSource source;
    private final ReentrantLock transitionLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object timerLock = new Object();

    private volatile Cancellable armedTick;

    public HeartbeatWatchdog(AlarmBroadcaster broadcaster,
                             WatchdogTimingPolicy timingPolicy,
                             MonotonicClock clock,
                             MonotonicScheduler scheduler,
                             WallClock wallClock,
                             AlarmObservabilitySink observabilitySink)
    {
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.source = new HeartbeatSource(timingPolicy.deadline().toNanos(), timingPolicy.silentStartRaises());

        if (!timingPolicy.hasBoundedDetectionLatency()) {
            log.warn("Watchdog {}: tick interval {} exceeds a quarter of deadline {}; detection may lag",
                    broadcaster.alarmName(), timingPolicy.tickInterval(), timingPolicy.deadline());
        }
    }

    public HeartbeatWatchdog(AlarmBroadcaster broadcaster,
                             WatchdogTimingPolicy timingPolicy,
                             MonotonicClock clock,
                             MonotonicScheduler scheduler)
    {
        this(broadcaster, timingPolicy, clock, scheduler, SystemWallClock.INSTANCE, null);
    }

    /**
     * Starts the silence clock and arms the periodic tick.
     * Idempotent while running.
     *
     * @throws IllegalStateException if the watchdog was closed
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("watchdog " + alarmName() + " is closed");
        }
        if (running.compareAndSet(false, true)) {
            long now = clock.nowNanos();
            source.start(now);
            arm(now + timingPolicy.tickInterval().toNanos());
            log.debug("Watchdog {} started: deadline={} tick={}",
                    alarmName(), timingPolicy.deadline(), timingPolicy.tickInterval());
        }
    }

    /**
     * Liveness signal from the monitored source.
     */
    public void onSignal() {
        onSignalAt(clock.nowNanos());
    }

    /**
     * Liveness signal observed at {@code nowNanos}. A time earlier than the last
     * recorded signal never moves the last-seen time backwards.
     */
    protected final void onSignalAt(long nowNanos) {
        if (source.recordSignal(nowNanos) == WatchdogState.ALIVE) {
            return;
        }

        transitionLock.lock();
        try {
            HeartbeatSource.Transition transition = source.revive();
            if (transition != null) {
                publish(transition);
            }
        } finally {
            transitionLock.unlock();
        }
    }

    /**
     * Re-evaluates silence. Called by the periodic timer; public so a caller
     * driving its own timer can use it directly.
     */
    public void onTick() {
        long now = clock.nowNanos();

        transitionLock.lock();
        try {
            HeartbeatSource.Transition transition = source.expire(now);
            if (transition != null) {
                publish(transition);
            } else if (source.state() == WatchdogState.TIMED_OUT && !broadcaster.current().raised()) {
                long silenceNanos = source.silenceNanos(now);
                log.warn("Watchdog {}: alarm cleared while still timed out ({} ms silent); raising again",
                        alarmName(), TimeUnit.NANOSECONDS.toMillis(silenceNanos));
                raise(Duration.ofNanos(silenceNanos));
            }
        } finally {
            transitionLock.unlock();
        }
    }

    public WatchdogState state() {
        return source.state();
    }

    public String alarmName() {
        return broadcaster.alarmName();
    }

    public WatchdogTimingPolicy timingPolicy() {
        return timingPolicy;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Cancels the periodic tick. The bound alarm keeps its last value.
     */
    @Override
    public void close() {
        closed.set(true);
        if (running.compareAndSet(true, false)) {
            synchronized (timerLock) {
                Cancellable tick = armedTick;
                if (tick != null) {
                    tick.cancel();
                    armedTick = null;
                }
            }
        }
    }

    protected final MonotonicClock clock() {
        return clock;
    }

    private void publish(HeartbeatSource.Transition transition) {
        Duration silence = Duration.ofNanos(transition.silenceNanos());

        if (transition.to() == WatchdogState.TIMED_OUT) {
            raise(silence);
        } else {
            broadcaster.clearAlarm();
        }

        observabilitySink.onWatchdogTransition(new WatchdogTransitionEvent(
                wallClock.now(),
                alarmName(),
                transition.from(),
                transition.to(),
                silence
        ));
    }

    private void raise(Duration silence) {
        String reason = "no signal for > " + timingPolicy.deadline().toMillis() + " ms";
        broadcaster.raiseAlarm(
                reason,
                Map.of(
                        "reason", reason,
                        "silenceMillis", Long.toString(silence.toMillis())
                ),
                AlarmRecord.MAX_SEVERITY
        );
    }

    private void arm(long deadlineNanos) {
        synchronized (timerLock) {
            if (running.get()) {
                armedTick = scheduler.scheduleAtNanos(deadlineNanos, () -> runTick(deadlineNanos));
            }
        }
    }

    private void runTick(long scheduledNanos) {
        if (!running.get()) {
            return;
        }
        try {
            onTick();
        } catch (RuntimeException e) {
            // The next tick must still be armed.
            observabilitySink.onError(new AlarmErrorEvent(
                    wallClock.now(),
                    "Watchdog " + alarmName() + " tick failed",
                    e
            ));
        } finally {
            arm(scheduledNanos + timingPolicy.tickInterval().toNanos());
        }
    }
}
