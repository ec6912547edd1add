// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Reduced view of a {@link Block}: validation results only, no transaction payloads.
 *
 * @param number               the block number
 * @param channelId            the channel the block was committed on
 * @param filteredTransactions per-transaction validation results in block order
 */
public record FilteredBlock(long number, String channelId, List<FilteredTransaction> filteredTransactions) {

    public FilteredBlock {
        if (number < 0) {
            throw new IllegalArgumentException("block number must be >= 0, got: " + number);
        }
        Objects.requireNonNull(channelId, "channelId");
        filteredTransactions = filteredTransactions == null ? List.of() : List.copyOf(filteredTransactions);
    }

    /**
     * Derives the filtered view of a full block.
     *
     * @param block the full block
     * @return the filtered block with the same number and channel
     */
    public static FilteredBlock from(final Block block) {
        Objects.requireNonNull(block, "block");
        List<FilteredTransaction> txs = block.transactions().stream()
                .map(tx -> new FilteredTransaction(tx.txId(), tx.type(), tx.validationCode(), tx.chaincodeEvents()))
                .toList();
        return new FilteredBlock(block.number(), block.channelId(), txs);
    }
}
