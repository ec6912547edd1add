// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.model.Block;

/**
 * Decides whether a block is delivered to a block-event subscriber.
 *
 * <p>
 * Filters must be side-effect free; they may be invoked from the dispatch thread
 * for any block of the stream. A filter that throws is treated as rejecting the
 * block.
 */
@FunctionalInterface
public interface BlockFilter {

    /**
     * @param block the raw block
     * @return {@code true} to deliver the block, {@code false} to skip it
     */
    boolean accept(Block block);
}
