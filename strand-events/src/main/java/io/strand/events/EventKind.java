// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

/**
 * Kinds of events a subscriber can register for.
 */
public enum EventKind {
    BLOCK,
    FILTERED_BLOCK,
    CHAINCODE,
    TX_STATUS,
    CONNECTION
}
