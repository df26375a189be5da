package com.questrail.killswitch.api;

import java.util.Optional;

/**
 * Handle for one registration on an {@link AlarmBus}.
 */
public interface AlarmSubscription extends AutoCloseable
{
    String alarmName();

    /**
     * Whether the subscription still receives deliveries.
     */
    boolean isActive();

    /**
     * The delivery failure that terminated this subscription, if any.
     */
    Optional<Throwable> failure();

    /**
     * Unsubscribes. No callback is started after this method returns.
     *
     * <p>A callback already running when {@code close()} is called is waited for,
     * up to the bus's listener shutdown timeout. If it is still running after
     * that, {@code close()} returns anyway and that invocation is the last one.
     * The same holds when {@code close()} is called from within the callback
     * itself, which is never waited for.</p>
     */
    @Override
    void close();
}
