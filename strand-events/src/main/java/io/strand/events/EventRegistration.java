// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import java.util.Objects;

/**
 * Result of a registration: the handle used to unregister and the channel events
 * arrive on.
 *
 * @param registration the opaque registration handle
 * @param events       the receive-only delivery channel
 * @param <T>          the event type
 */
public record EventRegistration<T>(Registration registration, EventChannel<T> events) {

    public EventRegistration {
        Objects.requireNonNull(registration, "registration");
        Objects.requireNonNull(events, "events");
    }
}
