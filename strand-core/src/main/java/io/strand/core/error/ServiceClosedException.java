// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.error;

/**
 * Thrown when an operation is attempted on an event service that has been closed,
 * either explicitly or because it was found idle.
 */
public final class ServiceClosedException extends StrandException {

    public ServiceClosedException(final String message) {
        super(message);
    }
}
