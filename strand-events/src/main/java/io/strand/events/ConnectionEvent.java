// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import org.jspecify.annotations.Nullable;

/**
 * Sent when the service connects to, or disconnects from, the event stream.
 *
 * <p>
 * {@code connected == false} means the stream was lost; {@code error} then holds
 * the cause. {@code connected == true} with a non-null {@code error} reports a
 * problem with a single raw event (for example an undecodable block) while the
 * stream itself stays up.
 *
 * @param connected whether the stream is up
 * @param error     the disconnect cause or dispatch error, if any
 */
public record ConnectionEvent(boolean connected, @Nullable Throwable error) {

    public static ConnectionEvent connectedEvent() {
        return new ConnectionEvent(true, null);
    }

    public static ConnectionEvent disconnected(final Throwable error) {
        return new ConnectionEvent(false, error);
    }
}
