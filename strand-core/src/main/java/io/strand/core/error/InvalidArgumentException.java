// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.error;

/**
 * Thrown when a registration is given a malformed filter, pattern or identifier.
 *
 * <p>
 * Raised synchronously before any registry state is touched, and never retried.
 */
public final class InvalidArgumentException extends StrandException {

    public InvalidArgumentException(final String message) {
        super(message);
    }

    public InvalidArgumentException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
