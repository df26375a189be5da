package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmBus;
import com.questrail.killswitch.api.AlarmCallback;
import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.api.AlarmSubscription;
import com.questrail.killswitch.config.AlarmBusConfig;
import com.questrail.killswitch.observability.AlarmBroadcastEvent;
import com.questrail.killswitch.observability.AlarmErrorEvent;
import com.questrail.killswitch.observability.AlarmObservabilitySink;
import com.questrail.killswitch.observability.NullObservabilitySink;
import com.questrail.killswitch.time.SystemWallClock;
import com.questrail.killswitch.time.WallClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * DefaultAlarmBus
 * =============================================================================
 * In-process {@link AlarmBus}.
 *
 * <h2>Locking</h2>
 * Each alarm name has its own {@link AlarmChannel}. A broadcast holds the
 * channel's delivery lock from storing the new record until it is enqueued to
 * every listener; storing the record and copying the listener list happen
 * together under the channel's registration lock. So:
 * <ul>
 *   <li>listeners of one name receive records in sequence order</li>
 *   <li>a subscriber registering concurrently sees either the pre- or the
 *       post-broadcast record first, then every later record exactly once</li>
 *   <li>a slow listener on {@code "hw-kill"} never delays {@code "network-loss"}</li>
 * </ul>
 *
 * <h2>Reads and registration</h2>
 * {@link #getOrCreate(String)} reads a volatile field and takes no lock.
 * {@link #subscribe}, {@link #unsubscribe} and {@link #awaitRecord} take only the
 * registration lock, so none of them waits behind a broadcaster that is blocked
 * on a full listener queue.
 *
 * <h2>Lifecycle</h2>
 * Records live as long as the bus. {@link #close()} terminates all
 * subscriptions; broadcasts after close still update records but reach no one.
 */
public final class DefaultAlarmBus implements AlarmBus
{
    private final ConcurrentMap<String, AlarmChannel> channels = new ConcurrentHashMap<>();
    private final AlarmBusConfig config;
    private final WallClock wallClock;
    private final AlarmObservabilitySink observabilitySink;
    private final AtomicLong subscriptionIds = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DefaultAlarmBus(AlarmBusConfig config, WallClock wallClock, AlarmObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public DefaultAlarmBus(AlarmBusConfig config)
    {
        this(config, SystemWallClock.INSTANCE, null);
    }

    public DefaultAlarmBus()
    {
        this(AlarmBusConfig.defaults());
    }

    @Override
    public AlarmRecord getOrCreate(String name) {
        return channel(name).current;
    }

    @Override
    public AlarmRecord broadcast(String name,
                                 boolean raised,
                                 String problemDescription,
                                 Map<String, String> parameters,
                                 String raisedBy,
                                 int severity)
    {
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(raisedBy, "raisedBy");

        AlarmChannel channel = channel(name);
        List<ListenerDispatcher> failed = new ArrayList<>();
        final AlarmRecord previous;
        final AlarmRecord next;

        channel.deliveryLock.lock();
        try {
            final List<ListenerDispatcher> targets;
            channel.lock.lock();
            try {
                previous = channel.current;
                next = new AlarmRecord(
                        channel.name,
                        raised,
                        problemDescription,
                        parameters,
                        raisedBy,
                        severity,
                        previous.sequence() + 1,
                        wallClock.now()
                );
                channel.current = next;
                channel.changed.signalAll();
                // Taken with the store: a subscriber is either in this list or saw next as its snapshot.
                targets = List.copyOf(channel.dispatchers);
            } finally {
                channel.lock.unlock();
            }

            for (ListenerDispatcher dispatcher : targets) {
                if (!dispatcher.enqueue(next) && detach(channel, dispatcher)) {
                    failed.add(dispatcher);
                }
            }
        } finally {
            channel.deliveryLock.unlock();
        }

        observabilitySink.onAlarmBroadcast(new AlarmBroadcastEvent(previous, next));

        for (ListenerDispatcher dispatcher : failed) {
            if (dispatcher.failure().isPresent()) {
                reportFailure(dispatcher);
            }
            dispatcher.shutdown();
        }
        return next;
    }

    @Override
    public AlarmSubscription subscribe(String name, AlarmCallback callback) {
        Objects.requireNonNull(callback, "callback");
        if (closed.get()) {
            throw new IllegalStateException("alarm bus is closed");
        }

        AlarmChannel channel = channel(name);
        ListenerDispatcher dispatcher = new ListenerDispatcher(
                this,
                channel.name,
                callback,
                config.deliveryQueueCapacity(),
                config.deliveryTimeout(),
                config.listenerShutdownTimeout()
        );

        channel.lock.lock();
        try {
            channel.dispatchers.add(dispatcher);
            try {
                // Under the registration lock: no broadcast can store a record between the snapshot and the add.
                dispatcher.deliverNow(channel.current);
            } catch (RuntimeException e) {
                channel.dispatchers.remove(dispatcher);
                throw new AlarmDeliveryException(
                        "listener on '" + channel.name + "' rejected its initial snapshot", e);
            }
        } finally {
            channel.lock.unlock();
        }

        dispatcher.start("alarm-listener-" + channel.name + "-" + subscriptionIds.incrementAndGet());
        return dispatcher;
    }

    @Override
    public void unsubscribe(AlarmSubscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        if (!(subscription instanceof ListenerDispatcher dispatcher)) {
            throw new IllegalArgumentException("subscription was not issued by this bus");
        }

        AlarmChannel channel = channels.get(dispatcher.alarmName());
        if (channel != null) {
            detach(channel, dispatcher);
        }
        dispatcher.shutdown();
    }

    @Override
    public Optional<AlarmRecord> awaitRecord(String name, Predicate<AlarmRecord> condition, Duration timeout)
            throws InterruptedException
    {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(timeout, "timeout");

        AlarmChannel channel = channel(name);
        long remainingNanos = timeout.toNanos();

        channel.lock.lockInterruptibly();
        try {
            while (true) {
                AlarmRecord record = channel.current;
                if (condition.test(record)) {
                    return Optional.of(record);
                }
                if (remainingNanos <= 0L) {
                    return Optional.empty();
                }
                remainingNanos = channel.changed.awaitNanos(remainingNanos);
            }
        } finally {
            channel.lock.unlock();
        }
    }

    @Override
    public Set<String> knownAlarms() {
        return Set.copyOf(channels.keySet());
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        for (AlarmChannel channel : channels.values()) {
            final List<ListenerDispatcher> dispatchers;
            channel.lock.lock();
            try {
                dispatchers = List.copyOf(channel.dispatchers);
                channel.dispatchers.clear();
            } finally {
                channel.lock.unlock();
            }
            dispatchers.forEach(ListenerDispatcher::shutdown);
        }
    }

    /**
     * Called from a dispatch thread whose callback threw.
     */
    void detachFailed(ListenerDispatcher dispatcher) {
        AlarmChannel channel = channels.get(dispatcher.alarmName());
        if (channel == null) {
            return;
        }

        if (detach(channel, dispatcher)) {
            reportFailure(dispatcher);
        }
        dispatcher.shutdown();
    }

    private static boolean detach(AlarmChannel channel, ListenerDispatcher dispatcher) {
        channel.lock.lock();
        try {
            return channel.dispatchers.remove(dispatcher);
        } finally {
            channel.lock.unlock();
        }
    }

    private void reportFailure(ListenerDispatcher dispatcher) {
        Throwable cause = dispatcher.failure().orElse(null);
        observabilitySink.onError(new AlarmErrorEvent(
                wallClock.now(),
                "Listener on '" + dispatcher.alarmName() + "' terminated",
                cause
        ));
    }

    private AlarmChannel channel(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("alarm name must be non-blank");
        }
        return channels.computeIfAbsent(name, n -> new AlarmChannel(AlarmRecord.initial(n, wallClock.now())));
    }
}
