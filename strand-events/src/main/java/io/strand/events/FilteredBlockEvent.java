// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.model.FilteredBlock;
import java.util.Objects;

/**
 * A filtered block delivered to a filtered-block subscriber.
 *
 * @param filteredBlock the filtered block
 */
public record FilteredBlockEvent(FilteredBlock filteredBlock) {

    public FilteredBlockEvent {
        Objects.requireNonNull(filteredBlock, "filteredBlock");
    }
}
