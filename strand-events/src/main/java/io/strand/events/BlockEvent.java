// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.model.Block;
import java.util.Objects;

/**
 * A full block delivered to a block-event subscriber.
 *
 * @param block the raw block
 */
public record BlockEvent(Block block) {

    public BlockEvent {
        Objects.requireNonNull(block, "block");
    }
}
