// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

/**
 * Decides whether the calling identity may receive a kind of event.
 *
 * <p>
 * Full blocks expose every transaction payload on the channel, so deployments
 * usually restrict {@link EventKind#BLOCK} registrations to privileged identities.
 * The decision itself (MSP roles, channel policies) is made by the implementation.
 */
@FunctionalInterface
public interface AuthorizationChecker {

    /**
     * @param kind the requested event kind
     * @return {@code true} if registration is permitted
     */
    boolean isAuthorized(EventKind kind);

    /**
     * Returns a checker that permits every event kind.
     */
    static AuthorizationChecker permitAll() {
        return kind -> true;
    }

    /**
     * Returns a checker that permits everything except full block events, matching
     * clients whose identity may only see filtered data.
     */
    static AuthorizationChecker filteredOnly() {
        return kind -> kind != EventKind.BLOCK;
    }
}
