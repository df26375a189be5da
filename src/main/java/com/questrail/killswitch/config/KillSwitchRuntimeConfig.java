package com.questrail.killswitch.config;

import com.questrail.killswitch.core.AlarmNames;
import com.questrail.killswitch.watchdog.WatchdogTimingPolicy;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated configuration for the kill switch runtime.
 *
 * <ul>
 *   <li><b>nodeId</b> — {@code raisedBy} identity of broadcasters created by the runtime.</li>
 *   <li><b>networkTimingPolicy</b> — deadline and tick of the network-loss watchdog.</li>
 *   <li><b>busConfig</b> — listener delivery bounds.</li>
 *   <li><b>heartbeatBindAddress</b> — UDP address on which shore heartbeats arrive.</li>
 *   <li><b>alarmBindAddress</b> — UDP address of the alarm egress socket (also answers queries).</li>
 *   <li><b>alarmTargets</b> — remote consumers of published alarm records.</li>
 *   <li><b>publishedAlarms</b> — alarms forwarded to {@code alarmTargets}.</li>
 *   <li><b>aggregateAlarm</b>, <b>memberAlarms</b> — wiring of the kill aggregator.</li>
 * </ul>
 */
public record KillSwitchRuntimeConfig(
    String nodeId,
    WatchdogTimingPolicy networkTimingPolicy,
    AlarmBusConfig busConfig,
    InetSocketAddress heartbeatBindAddress,
    InetSocketAddress alarmBindAddress,
    List<InetSocketAddress> alarmTargets,
    Set<String> publishedAlarms,
    String aggregateAlarm,
    List<String> memberAlarms
) {
    public KillSwitchRuntimeConfig {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(networkTimingPolicy, "networkTimingPolicy");
        Objects.requireNonNull(busConfig, "busConfig");
        Objects.requireNonNull(heartbeatBindAddress, "heartbeatBindAddress");
        Objects.requireNonNull(alarmBindAddress, "alarmBindAddress");
        alarmTargets = List.copyOf(Objects.requireNonNull(alarmTargets, "alarmTargets"));
        publishedAlarms = Set.copyOf(Objects.requireNonNull(publishedAlarms, "publishedAlarms"));
        Objects.requireNonNull(aggregateAlarm, "aggregateAlarm");
        memberAlarms = List.copyOf(Objects.requireNonNull(memberAlarms, "memberAlarms"));

        if (nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must be non-blank");
        }
        if (!memberAlarms.contains(AlarmNames.NETWORK_LOSS)) {
            throw new IllegalArgumentException("memberAlarms must include " + AlarmNames.NETWORK_LOSS);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String nodeId = "kill-switch";
        private WatchdogTimingPolicy networkTimingPolicy = WatchdogTimingPolicy.defaults();
        private AlarmBusConfig busConfig = AlarmBusConfig.defaults();
        private InetSocketAddress heartbeatBindAddress = new InetSocketAddress(0);
        private InetSocketAddress alarmBindAddress = new InetSocketAddress(0);
        private final List<InetSocketAddress> alarmTargets = new ArrayList<>();
        private final Set<String> publishedAlarms = new LinkedHashSet<>(
                List.of(AlarmNames.KILL, AlarmNames.HW_KILL, AlarmNames.NETWORK_LOSS));
        private String aggregateAlarm = AlarmNames.KILL;
        private List<String> memberAlarms = List.of(AlarmNames.HW_KILL, AlarmNames.NETWORK_LOSS);

        public Builder withNodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder withNetworkTimingPolicy(WatchdogTimingPolicy policy) {
            this.networkTimingPolicy = policy;
            return this;
        }

        public Builder withBusConfig(AlarmBusConfig busConfig) {
            this.busConfig = busConfig;
            return this;
        }

        public Builder withHeartbeatBindAddress(InetSocketAddress address) {
            this.heartbeatBindAddress = address;
            return this;
        }

        public Builder withAlarmBindAddress(InetSocketAddress address) {
            this.alarmBindAddress = address;
            return this;
        }

        public Builder addAlarmTarget(InetSocketAddress target) {
            this.alarmTargets.add(Objects.requireNonNull(target, "target"));
            return this;
        }

        public Builder publishAlarm(String alarmName) {
            this.publishedAlarms.add(Objects.requireNonNull(alarmName, "alarmName"));
            return this;
        }

        public Builder withAggregate(String aggregateAlarm, List<String> memberAlarms) {
            this.aggregateAlarm = aggregateAlarm;
            this.memberAlarms = memberAlarms;
            return this;
        }

        public KillSwitchRuntimeConfig build() {
            return new KillSwitchRuntimeConfig(
                    nodeId,
                    networkTimingPolicy,
                    busConfig,
                    heartbeatBindAddress,
                    alarmBindAddress,
                    alarmTargets,
                    publishedAlarms,
                    aggregateAlarm,
                    memberAlarms
            );
        }
    }
}
