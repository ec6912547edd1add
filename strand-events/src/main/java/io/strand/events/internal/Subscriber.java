// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import io.strand.core.InternalApi;
import io.strand.events.BlockEvent;
import io.strand.events.BlockFilter;
import io.strand.events.CcEvent;
import io.strand.events.ConnectionEvent;
import io.strand.events.EventKind;
import io.strand.events.FilteredBlockEvent;
import io.strand.events.TxStatusEvent;
import java.util.Objects;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Registry record for one subscription: its kind, its filter and the channel it owns.
 */
@InternalApi
public sealed interface Subscriber {

    EventKind kind();

    BoundedEventChannel<?> channel();

    record BlockSubscriber(@Nullable BlockFilter filter, BoundedEventChannel<BlockEvent> channel)
            implements Subscriber {
        public BlockSubscriber {
            Objects.requireNonNull(channel, "channel");
        }

        @Override
        public EventKind kind() {
            return EventKind.BLOCK;
        }
    }

    record FilteredBlockSubscriber(BoundedEventChannel<FilteredBlockEvent> channel) implements Subscriber {
        public FilteredBlockSubscriber {
            Objects.requireNonNull(channel, "channel");
        }

        @Override
        public EventKind kind() {
            return EventKind.FILTERED_BLOCK;
        }
    }

    record ChaincodeSubscriber(String chaincodeId, Pattern eventNamePattern, BoundedEventChannel<CcEvent> channel)
            implements Subscriber {
        public ChaincodeSubscriber {
            Objects.requireNonNull(chaincodeId, "chaincodeId");
            Objects.requireNonNull(eventNamePattern, "eventNamePattern");
            Objects.requireNonNull(channel, "channel");
        }

        @Override
        public EventKind kind() {
            return EventKind.CHAINCODE;
        }
    }

    record TxStatusSubscriber(String txId, BoundedEventChannel<TxStatusEvent> channel) implements Subscriber {
        public TxStatusSubscriber {
            Objects.requireNonNull(txId, "txId");
            Objects.requireNonNull(channel, "channel");
        }

        @Override
        public EventKind kind() {
            return EventKind.TX_STATUS;
        }
    }

    record ConnectionSubscriber(BoundedEventChannel<ConnectionEvent> channel) implements Subscriber {
        public ConnectionSubscriber {
            Objects.requireNonNull(channel, "channel");
        }

        @Override
        public EventKind kind() {
            return EventKind.CONNECTION;
        }
    }
}
