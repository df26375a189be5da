package com.questrail.killswitch.core;

import com.questrail.killswitch.api.AlarmRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-name state of a {@link DefaultAlarmBus}.
 *
 * <p>Two locks, always taken in this order:</p>
 * <ul>
 *   <li>{@link #deliveryLock} serializes broadcasts for this name. It is held
 *       while a broadcaster waits on slow listener queues.</li>
 *   <li>{@link #lock} guards {@link #current} writes, {@link #dispatchers} and
 *       {@link #changed}. It is only ever held for a few field updates or the
 *       synchronous snapshot callback, never across a queue wait.</li>
 * </ul>
 * {@link #current} is volatile so snapshot reads take neither lock.
 */
final class AlarmChannel
{
    final String name;
    final ReentrantLock deliveryLock = new ReentrantLock();
    final ReentrantLock lock = new ReentrantLock();
    final Condition changed = lock.newCondition();

    /** Guarded by {@link #lock} for writes. */
    volatile AlarmRecord current;

    /** Guarded by {@link #lock}. */
    final List<ListenerDispatcher> dispatchers = new ArrayList<>();

    AlarmChannel(AlarmRecord initial) {
        this.name = initial.name();
        this.current = initial;
    }
}
