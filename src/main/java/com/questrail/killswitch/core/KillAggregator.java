package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmBus;
import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.api.AlarmSubscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * KillAggregator
 * =============================================================================
 * Keeps an aggregate alarm (normally {@code "kill"}) in step with a set of
 * member alarms (normally {@code "hw-kill"} and {@code "network-loss"}).
 *
 * <h2>Semantics</h2>
 * The aggregate is an ordinary, independently broadcast alarm. The aggregator
 * re-evaluates on every member delivery and broadcasts only when the set of
 * raised members changes:
 * <ul>
 *   <li>non-empty set: raise, with {@code members} listing the raised names</li>
 *   <li>empty set: clear</li>
 * </ul>
 * A member that newly raises therefore re-raises the aggregate even if an
 * operator force-cleared it while another member was still raised. A
 * force-clear is otherwise left alone until the member set changes.
 *
 * <h2>Startup</h2>
 * Member snapshots arrive synchronously while subscribing. After the last
 * subscription the aggregate is broadcast only if the bus disagrees with it, so
 * a clean start does not emit a redundant clear.
 */
public final class KillAggregator implements AutoCloseable
{
    private final AlarmBroadcaster aggregate;
    private final List<String> members;
    private final List<AlarmSubscription> subscriptions = new ArrayList<>();

    private final Object lock = new Object();
    /** Guarded by {@link #lock}. */
    private final Set<String> raisedMembers = new TreeSet<>();
    /** Guarded by {@link #lock}; {@code false} until every member has been subscribed. */
    private boolean initialized;

    public KillAggregator(AlarmBus bus, String aggregateName, List<String> members) {
        Objects.requireNonNull(bus, "bus");
        this.aggregate = new AlarmBroadcaster(bus, aggregateName, AlarmNames.KILL_AGGREGATOR);
        this.members = List.copyOf(Objects.requireNonNull(members, "members"));

        if (this.members.isEmpty()) {
            throw new IllegalArgumentException("at least one member alarm required");
        }
        if (this.members.contains(aggregateName)) {
            throw new IllegalArgumentException("aggregate alarm cannot be its own member: " + aggregateName);
        }

        for (String member : this.members) {
            subscriptions.add(bus.subscribe(member, this::onMember));
        }

        synchronized (lock) {
            initialized = true;
            boolean shouldBeRaised = !raisedMembers.isEmpty();
            if (aggregate.current().raised() != shouldBeRaised) {
                publishLocked();
            }
        }
    }

    /**
     * Standard wiring: {@code "kill"} over {@code "hw-kill"} and {@code "network-loss"}.
     */
    public static KillAggregator standard(AlarmBus bus) {
        return new KillAggregator(bus, AlarmNames.KILL, List.of(AlarmNames.HW_KILL, AlarmNames.NETWORK_LOSS));
    }

    public String aggregateName() {
        return aggregate.alarmName();
    }

    public List<String> members() {
        return members;
    }

    /**
     * Member alarms currently raised, in name order.
     */
    public Set<String> raisedMembers() {
        synchronized (lock) {
            return Set.copyOf(raisedMembers);
        }
    }

    @Override
    public void close() {
        subscriptions.forEach(AlarmSubscription::close);
    }

    private void onMember(AlarmRecord record) {
        synchronized (lock) {
            boolean changed = record.raised()
                    ? raisedMembers.add(record.name())
                    : raisedMembers.remove(record.name());

            if (initialized && changed) {
                publishLocked();
            }
        }
    }

    private void publishLocked() {
        if (raisedMembers.isEmpty()) {
            aggregate.clearAlarm();
        } else {
            aggregate.raiseAlarm(
                    "kill requested by " + String.join(", ", raisedMembers),
                    Map.of("members", String.join(",", raisedMembers)),
                    AlarmRecord.MAX_SEVERITY
            );
        }
    }
}
