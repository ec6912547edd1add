// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.error;

/**
 * Thrown when the caller is not authorized to receive the requested kind of event.
 */
public final class PermissionDeniedException extends StrandException {

    private final String eventKind;

    public PermissionDeniedException(final String eventKind) {
        super("Not authorized to register for " + eventKind + " events");
        this.eventKind = eventKind;
    }

    public String eventKind() {
        return eventKind;
    }
}
