// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when the upstream event stream cannot be established or is lost.
 *
 * <p>
 * The first connection attempt reports this through the return of
 * {@code connect()}. Later drops are retried internally and only surface as the
 * error of a disconnected connection event.
 */
public sealed class ConnectionException extends StrandException permits ConnectionTimeoutException {

    private final @Nullable String endpoint;

    public ConnectionException(final String message) {
        this(message, null, null);
    }

    public ConnectionException(final String message, final @Nullable Throwable cause) {
        this(message, null, cause);
    }

    public ConnectionException(final String message, final @Nullable String endpoint, final @Nullable Throwable cause) {
        super(augmentMessage(message, endpoint), cause);
        this.endpoint = endpoint;
    }

    /**
     * Returns the endpoint the failure relates to, if known.
     *
     * @return the endpoint description, or {@code null}
     */
    public @Nullable String endpoint() {
        return endpoint;
    }

    private static String augmentMessage(final String message, final @Nullable String endpoint) {
        if (endpoint == null || message == null || message.isBlank()) {
            return message;
        }
        return "[endpoint=" + endpoint + "] " + message;
    }
}
