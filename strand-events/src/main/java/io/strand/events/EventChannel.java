// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;

/**
 * Receive side of a bounded delivery channel.
 *
 * <p>
 * Each registration owns exactly one channel. The service closes it exactly once:
 * when the registration is removed, or when the service itself closes. Events
 * buffered before the close can still be drained; nothing is accepted after it.
 *
 * <pre>{@code
 * EventRegistration<BlockEvent> reg = client.registerBlockEvent();
 * BlockEvent event;
 * while ((event = reg.events().take()) != null) {
 *     handle(event.block());
 * }
 * // channel closed and drained
 * }</pre>
 *
 * @param <T> the event type
 */
public interface EventChannel<T> {

    /**
     * Waits for the next event.
     *
     * @return the next event, or {@code null} once the channel is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    @Nullable T take() throws InterruptedException;

    /**
     * Waits up to the given time for the next event.
     *
     * @param timeout how long to wait
     * @param unit    the unit of {@code timeout}
     * @return the next event, or {@code null} on timeout or once the channel is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    @Nullable T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Returns whether the channel has been closed. A closed channel may still hold
     * buffered events.
     */
    boolean isClosed();

    /**
     * Returns the number of buffered events.
     */
    int size();

    /**
     * Returns how many events were dropped because the channel was full.
     */
    long droppedCount();
}
