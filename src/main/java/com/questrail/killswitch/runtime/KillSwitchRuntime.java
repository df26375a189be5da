package com.questrail.killswitch.runtime;

import com.questrail.killswitch.api.AlarmBus;
import com.questrail.killswitch.api.AlarmCallback;
import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.codec.AlarmRecordCodec;
import com.questrail.killswitch.codec.impl.BinaryAlarmRecordCodec;
import com.questrail.killswitch.config.KillSwitchRuntimeConfig;
import com.questrail.killswitch.core.AlarmAdministration;
import com.questrail.killswitch.core.AlarmBroadcaster;
import com.questrail.killswitch.core.AlarmListener;
import com.questrail.killswitch.core.AlarmNames;
import com.questrail.killswitch.core.DefaultAlarmBus;
import com.questrail.killswitch.core.KillAggregator;
import com.questrail.killswitch.observability.AlarmObservabilitySink;
import com.questrail.killswitch.observability.NullObservabilitySink;
import com.questrail.killswitch.observability.Slf4jAlarmObservabilitySink;
import com.questrail.killswitch.time.MonotonicClock;
import com.questrail.killswitch.time.MonotonicScheduler;
import com.questrail.killswitch.time.ScheduledExecutorScheduler;
import com.questrail.killswitch.time.SystemMonotonicClock;
import com.questrail.killswitch.time.SystemWallClock;
import com.questrail.killswitch.time.WallClock;
import com.questrail.killswitch.transport.DatagramEndpoint;
import com.questrail.killswitch.transport.udp.AlarmDatagramPublisher;
import com.questrail.killswitch.transport.udp.HeartbeatDatagramReceiver;
import com.questrail.killswitch.transport.udp.netty.NettyUdpDatagramEndpoint;
import com.questrail.killswitch.watchdog.NetworkLossWatchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * KillSwitchRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the kill switch stack.
 *
 * <pre>
 *   UDP heartbeat  → HeartbeatDatagramReceiver → NetworkLossWatchdog ─┐
 *                                                                     ├→ AlarmBus
 *   hw-kill driver → AlarmBroadcaster("hw-kill") ─────────────────────┘     │
 *                                                                          ├→ KillAggregator → "kill"
 *                                                                          └→ AlarmDatagramPublisher → UDP
 * </pre>
 *
 * <p>Start order: bus consumers first (aggregator, egress), then the watchdog,
 * then heartbeat ingress. Stop runs in reverse, then shuts down the scheduler
 * executor if this runtime created it.</p>
 */
public final class KillSwitchRuntime {
    private static final Logger log = LoggerFactory.getLogger(KillSwitchRuntime.class);

    private final KillSwitchRuntimeConfig config;
    private final DefaultAlarmBus bus;
    private final AlarmAdministration administration;
    private final NetworkLossWatchdog networkLossWatchdog;
    private final HeartbeatDatagramReceiver heartbeatReceiver;
    private final AlarmDatagramPublisher alarmPublisher;
    private final ScheduledExecutorService schedulerExecutor;

    private KillAggregator aggregator;

    private KillSwitchRuntime(
            KillSwitchRuntimeConfig config,
            DefaultAlarmBus bus,
            NetworkLossWatchdog networkLossWatchdog,
            HeartbeatDatagramReceiver heartbeatReceiver,
            AlarmDatagramPublisher alarmPublisher,
            ScheduledExecutorService schedulerExecutor) {
        this.config = config;
        this.bus = bus;
        this.administration = new AlarmAdministration(bus);
        this.networkLossWatchdog = networkLossWatchdog;
        this.heartbeatReceiver = heartbeatReceiver;
        this.alarmPublisher = alarmPublisher;
        this.schedulerExecutor = schedulerExecutor;
    }

    public synchronized void start() {
        if (aggregator != null) {
            return;
        }
        aggregator = new KillAggregator(bus, config.aggregateAlarm(), config.memberAlarms());
        alarmPublisher.start();
        networkLossWatchdog.start();
        heartbeatReceiver.start();
        log.info("Kill switch {} started: {} over {}, network deadline {}",
                config.nodeId(), config.aggregateAlarm(), config.memberAlarms(),
                config.networkTimingPolicy().deadline());
    }

    public synchronized void stop() {
        heartbeatReceiver.stop();
        networkLossWatchdog.close();
        alarmPublisher.stop();
        if (aggregator != null) {
            aggregator.close();
            aggregator = null;
        }
        bus.close();

        if (schedulerExecutor != null) {
            schedulerExecutor.shutdown();
            try {
                if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    schedulerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                schedulerExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Kill switch {} stopped", config.nodeId());
    }

    public AlarmBus bus() {
        return bus;
    }

    public AlarmAdministration administration() {
        return administration;
    }

    public NetworkLossWatchdog networkLossWatchdog() {
        return networkLossWatchdog;
    }

    /**
     * Broadcaster for {@code alarmName} identified by this runtime's node id.
     */
    public AlarmBroadcaster broadcaster(String alarmName) {
        return new AlarmBroadcaster(bus, alarmName, config.nodeId());
    }

    public AlarmListener listener(String alarmName, AlarmCallback callback) {
        return new AlarmListener(bus, alarmName, callback);
    }

    public AlarmRecord currentAlarm(String alarmName) {
        return bus.getOrCreate(alarmName);
    }

    /**
     * Administrative force-clear; see {@link AlarmAdministration}.
     */
    public AlarmRecord forceClear(String alarmName) {
        return administration.forceClear(alarmName);
    }

    public static Builder builder(KillSwitchRuntimeConfig config) {
        return new Builder(config);
    }

    public static final class Builder {
        private final KillSwitchRuntimeConfig config;
        private AlarmObservabilitySink observabilitySink = new Slf4jAlarmObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private DatagramEndpoint heartbeatEndpoint;
        private DatagramEndpoint alarmEndpoint;
        private AlarmRecordCodec codec = new BinaryAlarmRecordCodec();

        private Builder(KillSwitchRuntimeConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /**
         * Defaults to SLF4J logging.
         */
        public Builder withObservabilitySink(AlarmObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replaces the system clock and scheduler, e.g. with a deterministic pair.
         */
        public Builder withTiming(MonotonicClock clock, MonotonicScheduler scheduler) {
            this.clock = clock;
            this.scheduler = scheduler;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withHeartbeatEndpoint(DatagramEndpoint endpoint) {
            this.heartbeatEndpoint = endpoint;
            return this;
        }

        public Builder withAlarmEndpoint(DatagramEndpoint endpoint) {
            this.alarmEndpoint = endpoint;
            return this;
        }

        public Builder withCodec(AlarmRecordCodec codec) {
            this.codec = codec;
            return this;
        }

        public KillSwitchRuntime build() {
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(codec, "codec");
            AlarmObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Timing
            ScheduledExecutorService schedulerExec = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "kill-switch-watchdog");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            }

            // 2. Bus
            DefaultAlarmBus bus = new DefaultAlarmBus(config.busConfig(), wallClock, sink);

            // 3. Network-loss watchdog
            NetworkLossWatchdog watchdog = new NetworkLossWatchdog(
                    new AlarmBroadcaster(bus, AlarmNames.NETWORK_LOSS, config.nodeId()),
                    config.networkTimingPolicy(),
                    clock,
                    effectiveScheduler,
                    wallClock,
                    sink
            );

            // 4. Transports
            DatagramEndpoint ingress = heartbeatEndpoint != null
                    ? heartbeatEndpoint
                    : new NettyUdpDatagramEndpoint(config.heartbeatBindAddress());
            DatagramEndpoint egress = alarmEndpoint != null
                    ? alarmEndpoint
                    : new NettyUdpDatagramEndpoint(config.alarmBindAddress());

            HeartbeatDatagramReceiver receiver = new HeartbeatDatagramReceiver(ingress, watchdog);
            AlarmDatagramPublisher publisher = new AlarmDatagramPublisher(
                    bus,
                    egress,
                    codec,
                    config.alarmTargets(),
                    config.publishedAlarms(),
                    wallClock,
                    sink
            );

            return new KillSwitchRuntime(config, bus, watchdog, receiver, publisher, schedulerExec);
        }
    }
}
