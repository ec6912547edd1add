// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

/**
 * Lifecycle state of the single upstream event-stream connection.
 *
 * <p>State transitions:
 * <pre>
 * DISCONNECTED --connect()--> CONNECTING --(success)--> CONNECTED
 *      ^                          |                         |
 *      +-------(failure)----------+                         | (stream error / EOF)
 *      +<-----------------------------------------------------+
 *      |   (reconnect with backoff: DISCONNECTED -> CONNECTING -> ...)
 *
 * any non-terminal state --close()--> CLOSING --> CLOSED
 * </pre>
 *
 * <p>{@link #CLOSED} is terminal: the service cannot be reused.
 */
public enum ConnectionState {
    /** No stream; either never connected or lost and waiting to reconnect. */
    DISCONNECTED,
    /** A stream is being established. */
    CONNECTING,
    /** Events are flowing. */
    CONNECTED,
    /** Close in progress: channels are being closed and the receive loop stopped. */
    CLOSING,
    /** Permanently closed. */
    CLOSED
}
