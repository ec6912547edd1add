// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

/**
 * What the dispatcher does when a subscriber's channel is full.
 *
 * <p>
 * The policy is fixed per service instance and applies to every block,
 * filtered-block, chaincode and transaction-status channel alike. Connection
 * events are always offered without waiting so that connection bookkeeping never
 * stalls on a slow reader.
 */
public enum BackpressurePolicy {
    /**
     * Wait until the channel has room, is closed, or the service closes.
     * Nothing is ever dropped, but one stalled subscriber stalls dispatch for all.
     */
    BLOCK,

    /**
     * Drop the event immediately and count the drop. Other subscribers are unaffected.
     */
    DROP,

    /**
     * Wait up to the configured consumer timeout, then drop and count.
     * Bounds the stall a slow subscriber can cause.
     */
    TIMEOUT
}
