package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmCallback;
import com.questrail.killswitch.api.AlarmRecord;
import com.questrail.killswitch.api.AlarmSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ListenerDispatcher
 * =============================================================================
 * One subscription on a {@link DefaultAlarmBus}: a bounded queue of pending
 * records plus the thread that drains it into the callback.
 *
 * <h2>Threading Model</h2>
 * Broadcasters enqueue while holding the alarm's delivery lock, so the queue
 * order is the sequence order. A single dispatch thread invokes the callback,
 * so callbacks for one subscription never overlap.
 *
 * <h2>Backpressure</h2>
 * {@link #enqueue(AlarmRecord)} blocks for up to the delivery timeout when the
 * queue is full. If the queue is still full the subscription fails: it is
 * better to tell the consumer it lost track than to drop a kill transition
 * behind its back.
 */
final class ListenerDispatcher implements AlarmSubscription
{
    private static final Logger log = LoggerFactory.getLogger(ListenerDispatcher.class);

    private final DefaultAlarmBus bus;
    private final String alarmName;
    private final AlarmCallback callback;
    private final BlockingQueue<AlarmRecord> queue;
    private final long deliveryTimeoutNanos;
    private final Duration shutdownTimeout;

    private final AtomicBoolean closing = new AtomicBoolean(false);
    private volatile boolean active = true;
    private volatile Throwable failure;
    private volatile Thread thread;

    ListenerDispatcher(DefaultAlarmBus bus,
                       String alarmName,
                       AlarmCallback callback,
                       int capacity,
                       Duration deliveryTimeout,
                       Duration shutdownTimeout)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.alarmName = Objects.requireNonNull(alarmName, "alarmName");
        this.callback = Objects.requireNonNull(callback, "callback");
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.deliveryTimeoutNanos = deliveryTimeout.toNanos();
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    /**
     * Invokes the callback on the calling thread. Used once, for the snapshot
     * delivered by {@code subscribe}.
     */
    void deliverNow(AlarmRecord record) {
        callback.onAlarm(record);
    }

    void start(String threadName) {
        Thread t = new Thread(this::runDispatchLoop, threadName);
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /**
     * Enqueues a record for delivery. Called with the channel's delivery lock
     * held, never its registration lock.
     *
     * @return {@code false} if this subscription is no longer active and must
     *         be removed from its channel
     */
    boolean enqueue(AlarmRecord record) {
        if (!active) {
            return false;
        }

        boolean interrupted = false;
        long deadline = System.nanoTime() + deliveryTimeoutNanos;
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                try {
                    if (queue.offer(record, Math.max(0L, remaining), TimeUnit.NANOSECONDS)) {
                        return active;
                    }
                    break;
                } catch (InterruptedException e) {
                    // Keep waiting: abandoning the record would drop a transition.
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        fail(new AlarmDeliveryException(String.format(
                "listener on '%s' did not accept seq %d within %d ms",
                alarmName, record.sequence(), TimeUnit.NANOSECONDS.toMillis(deliveryTimeoutNanos))));
        return false;
    }

    @Override
    public String alarmName() {
        return alarmName;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public void close() {
        bus.unsubscribe(this);
    }

    /**
     * Stops delivery. Called by the bus after the dispatcher has been removed
     * from its channel, or by the dispatcher itself on failure.
     */
    void shutdown() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        deactivate();

        Thread t = thread;
        if (t == null || t == Thread.currentThread()) {
            return;
        }

        t.interrupt();
        long waitMillis = shutdownTimeout.toMillis();
        if (waitMillis <= 0) {
            // join(0) would wait forever.
            return;
        }
        try {
            t.join(waitMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("Listener on '{}' still running its callback {} ms after close; no further records will be delivered",
                    alarmName, shutdownTimeout.toMillis());
        }
    }

    private void deactivate() {
        active = false;
        // Frees any broadcaster blocked in offer().
        queue.clear();
    }

    private void fail(Throwable cause) {
        if (failure == null) {
            failure = cause;
        }
        deactivate();
    }

    private void runDispatchLoop() {
        while (active) {
            final AlarmRecord record;
            try {
                record = queue.take();
            } catch (InterruptedException e) {
                // Expected during shutdown
                continue;
            }

            if (!active) {
                break;
            }

            try {
                callback.onAlarm(record);
            } catch (RuntimeException e) {
                fail(new AlarmDeliveryException(String.format(
                        "listener on '%s' threw while handling seq %d", alarmName, record.sequence()), e));
                bus.detachFailed(this);
                return;
            }
        }
    }
}
