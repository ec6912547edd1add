// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.error.ConnectionException;
import io.strand.core.error.ConnectionTimeoutException;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Supplier of upstream event streams.
 *
 * <p>
 * The event service owns at most one open {@link EventConnection} at a time and
 * asks the source for a fresh one after every failure. How the source picks a peer,
 * authenticates or pools transports is outside the service's concern.
 *
 * <p>
 * <strong>Built-in Implementations:</strong>
 * <ul>
 * <li>{@link WebSocketEventSource} - JSON block events over a WebSocket</li>
 * </ul>
 */
public interface EventSource {

    /**
     * Opens a new event stream.
     *
     * @param startBlock first block number to deliver, or {@code null} for the newest block
     * @param timeout    how long establishing the stream may take
     * @return the open connection
     * @throws ConnectionTimeoutException if the stream is not up within {@code timeout}
     * @throws ConnectionException        if the stream cannot be established
     */
    EventConnection open(@Nullable Long startBlock, Duration timeout);

    /**
     * Describes the upstream endpoint for logs and error messages.
     *
     * @return a human-readable endpoint description
     */
    default String endpoint() {
        return getClass().getSimpleName();
    }
}
