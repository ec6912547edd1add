// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.model;

import io.strand.core.types.Hash;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An ordered batch of committed transactions plus header data, as delivered by a
 * peer's event stream.
 *
 * @param number       the block number
 * @param dataHash     the hash of the block data, if the source supplied it
 * @param previousHash the hash of the previous block header, if the source supplied it
 * @param channelId    the channel the block was committed on
 * @param transactions the transactions in block order
 */
public record Block(
        long number,
        @Nullable Hash dataHash,
        @Nullable Hash previousHash,
        String channelId,
        List<Transaction> transactions) {

    public Block {
        if (number < 0) {
            throw new IllegalArgumentException("block number must be >= 0, got: " + number);
        }
        Objects.requireNonNull(channelId, "channelId");
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
