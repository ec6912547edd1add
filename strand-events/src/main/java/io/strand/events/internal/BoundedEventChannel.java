// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import io.strand.core.InternalApi;
import io.strand.events.EventChannel;
import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;

/**
 * Bounded single-owner delivery channel.
 *
 * <p>
 * The dispatcher is the only producer; the subscriber is the only intended
 * consumer. All state is guarded by one lock, so a send either lands before
 * {@link #close()} or is rejected by it; there is no window in which an event is
 * accepted by a closed channel.
 *
 * @param <T> the event type
 */
@InternalApi
public final class BoundedEventChannel<T> implements EventChannel<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<T> buffer;
    private final int capacity;
    private final LongAdder dropped = new LongAdder();
    private boolean closed;

    public BoundedEventChannel(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Adds an event if there is room.
     *
     * @return {@code true} if accepted; {@code false} if full or closed
     */
    public boolean offer(final T event) {
        lock.lock();
        try {
            if (closed || buffer.size() >= capacity) {
                return false;
            }
            enqueue(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds an event, waiting up to the given time for room.
     *
     * @return {@code true} if accepted; {@code false} on timeout or if the channel is (or becomes) closed
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean offer(final T event, final long timeout, final TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!closed && buffer.size() >= capacity) {
                if (nanos <= 0L) {
                    return false;
                }
                nanos = notFull.awaitNanos(nanos);
            }
            if (closed) {
                return false;
            }
            enqueue(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds an event, waiting as long as necessary for room.
     *
     * @return {@code true} if accepted; {@code false} if the channel is (or becomes) closed
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean put(final T event) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && buffer.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                return false;
            }
            enqueue(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records an event that was not accepted because the channel was full.
     */
    public void recordDrop() {
        dropped.increment();
    }

    /**
     * Closes the channel and wakes every waiting producer and consumer.
     *
     * @return {@code true} for the call that actually closed the channel, {@code false} afterwards
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public @Nullable T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed) {
                    return null;
                }
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public @Nullable T poll(final long timeout, final TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed || nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long droppedCount() {
        return dropped.sum();
    }

    public int capacity() {
        return capacity;
    }

    private void enqueue(final T event) {
        buffer.addLast(event);
        notEmpty.signal();
    }

    private T dequeue() {
        T event = buffer.removeFirst();
        notFull.signal();
        return event;
    }
}
