// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import io.strand.core.InternalApi;
import io.strand.core.error.InvalidArgumentException;
import io.strand.core.model.Block;
import io.strand.core.model.ChaincodeEvent;
import io.strand.events.BlockFilter;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Stateless predicates deciding which subscribers receive an event.
 *
 * <p>
 * Chaincode event names are matched with search semantics
 * ({@link java.util.regex.Matcher#find()}): the pattern matches if it occurs
 * anywhere in the name. {@code "^evt.*"} therefore accepts {@code "evt1"} but not
 * {@code "my-evt"}, while a bare {@code "evt"} accepts both.
 */
@InternalApi
public final class EventFilters {

    private EventFilters() {
        // Utility class
    }

    /**
     * Evaluates an optional block filter. A filter that throws rejects the block.
     *
     * @param filter the filter, or {@code null} to accept every block
     * @param block  the raw block
     * @param log    where filter failures are reported
     * @return whether the block is delivered
     */
    public static boolean matchesBlock(final @Nullable BlockFilter filter, final Block block, final Logger log) {
        if (filter == null) {
            return true;
        }
        try {
            return filter.accept(block);
        } catch (RuntimeException e) {
            log.warn("Block filter failed on block {}, skipping delivery", block.number(), e);
            return false;
        }
    }

    /**
     * Matches a chaincode event against a chaincode subscription.
     *
     * @param chaincodeId      the subscribed chaincode id (exact match)
     * @param eventNamePattern the subscribed event-name pattern (search match)
     * @param event            the chaincode event
     * @return whether the event is delivered
     */
    public static boolean matchesChaincode(
            final String chaincodeId, final Pattern eventNamePattern, final ChaincodeEvent event) {
        return chaincodeId.equals(event.chaincodeId())
                && eventNamePattern.matcher(event.eventName()).find();
    }

    /**
     * Matches a transaction id against a transaction-status subscription.
     *
     * @param subscribedTxId the subscribed transaction id (exact match)
     * @param txId           the id of a transaction in the block
     * @return whether the status is delivered
     */
    public static boolean matchesTxId(final String subscribedTxId, final String txId) {
        return subscribedTxId.equals(txId);
    }

    /**
     * Compiles a chaincode event-name pattern.
     *
     * @param eventNamePattern the regular expression
     * @return the compiled pattern
     * @throws InvalidArgumentException if the expression is null or invalid
     */
    public static Pattern compileEventNamePattern(final String eventNamePattern) {
        if (eventNamePattern == null) {
            throw new InvalidArgumentException("eventNamePattern must not be null");
        }
        try {
            return Pattern.compile(eventNamePattern);
        } catch (PatternSyntaxException e) {
            throw new InvalidArgumentException("Invalid chaincode event name pattern: " + eventNamePattern, e);
        }
    }
}
