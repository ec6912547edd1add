// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

/**
 * Opaque handle returned by a successful registration.
 *
 * <p>
 * The handle is the only way to remove a subscription again; pass it to
 * {@link EventService#unregister(Registration)}. It carries no meaning beyond its
 * identity and is never reused: once unregistered, a handle is permanently
 * invalid, even if the service later hands out a handle for a new subscription.
 */
public interface Registration {
}
