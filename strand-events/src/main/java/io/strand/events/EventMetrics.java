// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import java.time.Duration;

/**
 * Interface for collecting metrics from the event service.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or any other monitoring
 * system. By default a no-op implementation is used ({@link #noop()}).
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe. Dispatch
 * callbacks arrive on the background receive thread, connection callbacks may
 * arrive on the thread calling {@code connect()}.
 */
public interface EventMetrics {

    /**
     * Called after an event was placed on a subscriber channel.
     *
     * @param kind the event kind
     */
    default void onEventDelivered(EventKind kind) {
    }

    /**
     * Called when an event was dropped because the subscriber channel was full.
     *
     * @param kind the event kind
     */
    default void onEventDropped(EventKind kind) {
    }

    /**
     * Called after all deliveries for one raw block finished.
     *
     * @param blockNumber the block number
     * @param latency     time spent dispatching the block
     */
    default void onBlockDispatched(long blockNumber, Duration latency) {
    }

    /**
     * Called when the event stream is lost.
     *
     * @param error the cause
     */
    default void onConnectionLost(Throwable error) {
    }

    /**
     * Called when the event stream is re-established after a loss.
     *
     * @param attempt the reconnect attempt that succeeded (1-based)
     */
    default void onReconnect(long attempt) {
    }

    /**
     * Called when a single raw event could not be dispatched.
     *
     * @param error the failure
     */
    default void onDispatchError(Throwable error) {
    }

    /**
     * Returns a no-op metrics implementation that does nothing.
     *
     * @return a no-op EventMetrics instance
     */
    static EventMetrics noop() {
        return NoopEventMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of EventMetrics.
 */
enum NoopEventMetrics implements EventMetrics {
    INSTANCE
}
