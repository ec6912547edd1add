// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.error;

import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the event stream could not be established within the connect deadline.
 */
public final class ConnectionTimeoutException extends ConnectionException {

    private final Duration timeout;

    public ConnectionTimeoutException(final @Nullable String endpoint, final Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for the event stream", endpoint, null);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
