// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.model.Block;
import io.strand.core.model.FilteredBlock;
import java.util.Objects;

/**
 * A single already-decoded event read from the upstream stream.
 *
 * <p>
 * Depending on how the stream was opened, a peer delivers either full blocks or
 * filtered blocks. Transaction-status and chaincode events are derived from these
 * by the dispatcher.
 */
public sealed interface RawEvent permits RawEvent.BlockReceived, RawEvent.FilteredBlockReceived {

    /**
     * Returns the number of the block this event carries.
     */
    long blockNumber();

    /**
     * A full block with transaction payloads.
     *
     * @param block the block
     */
    record BlockReceived(Block block) implements RawEvent {
        public BlockReceived {
            Objects.requireNonNull(block, "block");
        }

        @Override
        public long blockNumber() {
            return block.number();
        }
    }

    /**
     * A filtered block carrying validation results only.
     *
     * @param filteredBlock the filtered block
     */
    record FilteredBlockReceived(FilteredBlock filteredBlock) implements RawEvent {
        public FilteredBlockReceived {
            Objects.requireNonNull(filteredBlock, "filteredBlock");
        }

        @Override
        public long blockNumber() {
            return filteredBlock.number();
        }
    }
}
