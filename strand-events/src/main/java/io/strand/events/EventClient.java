// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.error.ConnectionException;
import io.strand.core.error.ConnectionTimeoutException;
import io.strand.core.error.ServiceClosedException;
import java.time.Duration;

/**
 * An {@link EventService} that owns the connection to a peer's event stream.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try (EventClient client = DefaultEventClient.builder(source).build()) {
 *     EventRegistration<TxStatusEvent> reg = client.registerTxStatusEvent(txId);
 *     client.connect();
 *     TxStatusEvent status = reg.events().poll(30, TimeUnit.SECONDS);
 *     client.unregister(reg.registration());
 * }
 * }</pre>
 */
public interface EventClient extends EventService, AutoCloseable {

    /**
     * Connects to the event stream using the configured connect timeout.
     *
     * @throws ConnectionTimeoutException if the stream is not up in time
     * @throws ConnectionException        if the stream cannot be established
     * @throws ServiceClosedException     if the client is closed
     */
    void connect();

    /**
     * Connects to the event stream within the given deadline.
     *
     * <p>
     * A no-op while connected, or while a lost stream is being re-established in the
     * background.
     *
     * @param timeout the connect deadline
     * @throws ConnectionTimeoutException if the stream is not up in time
     * @throws ConnectionException        if the stream cannot be established
     * @throws ServiceClosedException     if the client is closed
     */
    void connect(Duration timeout);

    /**
     * Registers for connection events: one {@code connected=true} event per established
     * stream and one {@code connected=false} event per lost stream.
     *
     * @return the registration and its channel
     * @throws ServiceClosedException if the client is closed
     */
    EventRegistration<ConnectionEvent> registerConnectionEvent();

    /**
     * Closes the connection only if there are no outstanding registrations.
     *
     * @return {@code true} if the client was closed and may no longer be used;
     *         {@code false} if at least one registration was outstanding
     */
    boolean closeIfIdle();

    /**
     * Returns the current connection state.
     */
    ConnectionState connectionState();

    /**
     * Closes the connection, closes every remaining channel and stops the receive
     * loop. Blocks until no further event can be sent. Idempotent; the client may not
     * be used afterwards.
     */
    @Override
    void close();
}
