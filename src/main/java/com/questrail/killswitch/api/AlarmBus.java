package com.questrail.killswitch.api;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * AlarmBus
 * -----------------------------------------------------------------------------
 * Registry mapping alarm name to its current {@link AlarmRecord}. All reads,
 * writes and subscriptions for alarms go through the bus.
 *
 * <h2>Lazy registration</h2>
 * Reading, broadcasting or subscribing to a name that was never seen creates a
 * default cleared record with sequence {@code 0}. There is no startup ordering
 * requirement between the component that raises an alarm and the component
 * that observes it.
 *
 * <h2>Ordering</h2>
 * Broadcasts on one name are mutually exclusive and every listener receives
 * them in sequence order. Broadcasts on different names never contend and
 * carry no relative ordering guarantee.
 *
 * <h2>Delivery</h2>
 * Delivery favors correctness over throughput. A slow listener blocks the
 * broadcaster (bounded by the bus configuration) rather than losing or
 * coalescing a transition. A listener that cannot keep up within that bound,
 * or whose callback throws, is terminated and reported.
 */
public interface AlarmBus extends AutoCloseable
{
    /**
     * Returns the current record for {@code name}, creating the default
     * cleared record if the name is unknown. Never fails for a valid name.
     */
    AlarmRecord getOrCreate(String name);

    /**
     * Constructs and stores the next record for {@code name} and delivers it to
     * every listener registered at call time.
     *
     * @return the record that was stored
     */
    AlarmRecord broadcast(String name,
                          boolean raised,
                          String problemDescription,
                          Map<String, String> parameters,
                          String raisedBy,
                          int severity);

    /**
     * Registers {@code callback} and delivers the current snapshot to it on the
     * calling thread before returning. Subsequent broadcasts are delivered
     * asynchronously, in order.
     */
    AlarmSubscription subscribe(String name, AlarmCallback callback);

    /**
     * Removes the registration. Equivalent to {@link AlarmSubscription#close()}.
     */
    void unsubscribe(AlarmSubscription subscription);

    /**
     * Blocks until the record for {@code name} satisfies {@code condition} or
     * the timeout elapses. The current record is tested first.
     *
     * @return the first matching record, or empty on timeout
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<AlarmRecord> awaitRecord(String name, Predicate<AlarmRecord> condition, Duration timeout)
            throws InterruptedException;

    /**
     * Names of every alarm the bus currently knows.
     */
    Set<String> knownAlarms();

    /**
     * Terminates every subscription. Records remain readable.
     */
    @Override
    void close();
}
