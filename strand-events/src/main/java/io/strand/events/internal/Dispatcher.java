// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import io.strand.core.InternalApi;
import io.strand.core.model.Block;
import io.strand.core.model.ChaincodeEvent;
import io.strand.core.model.FilteredBlock;
import io.strand.core.model.FilteredTransaction;
import io.strand.core.model.Transaction;
import io.strand.core.model.TxValidationCode;
import io.strand.events.BackpressurePolicy;
import io.strand.events.BlockEvent;
import io.strand.events.CcEvent;
import io.strand.events.ConnectionEvent;
import io.strand.events.EventKind;
import io.strand.events.EventMetrics;
import io.strand.events.EventServiceConfig;
import io.strand.events.FilteredBlockEvent;
import io.strand.events.RawEvent;
import io.strand.events.TxStatusEvent;
import io.strand.events.internal.Subscriber.BlockSubscriber;
import io.strand.events.internal.Subscriber.ChaincodeSubscriber;
import io.strand.events.internal.Subscriber.ConnectionSubscriber;
import io.strand.events.internal.Subscriber.FilteredBlockSubscriber;
import io.strand.events.internal.Subscriber.TxStatusSubscriber;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Fans raw events out to the matching subscriber channels.
 *
 * <p>
 * {@link #dispatch(RawEvent)} is called from the single receive thread. Every
 * delivery for one raw block completes before the call returns, so events reach
 * each channel in block order. Chaincode events are published only for
 * transactions that committed as {@link TxValidationCode#VALID}.
 *
 * <p>
 * Full channels are handled according to the configured {@link BackpressurePolicy}.
 * Connection events are always offered without waiting.
 */
@InternalApi
public final class Dispatcher {

    private final SubscriberRegistry registry;
    private final BackpressurePolicy policy;
    private final long consumerTimeoutNanos;
    private final Logger log;
    private final EventMetrics metrics;
    private final AtomicLong lastBlockNumber = new AtomicLong(-1L);

    public Dispatcher(final SubscriberRegistry registry, final EventServiceConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(config, "config");
        this.policy = config.backpressurePolicy();
        this.consumerTimeoutNanos = config.consumerTimeout().toNanos();
        this.log = config.logger();
        this.metrics = config.metrics();
    }

    /**
     * Delivers one raw event to every matching subscriber.
     *
     * <p>
     * Blocks whose number is not greater than the last dispatched block are skipped.
     * Failures inside the pass are reported through {@link #reportDispatchError} and
     * do not propagate.
     *
     * @param event the raw event
     * @throws InterruptedException if interrupted while waiting on a full channel
     */
    public void dispatch(final RawEvent event) throws InterruptedException {
        Objects.requireNonNull(event, "event");
        long number = event.blockNumber();
        long last = lastBlockNumber.get();
        if (number <= last) {
            log.debug("Skipping block {} (last dispatched {})", number, last);
            return;
        }
        long start = System.nanoTime();
        SubscriberRegistry.Snapshot snapshot = registry.snapshot();
        try {
            if (event instanceof RawEvent.BlockReceived received) {
                dispatchBlock(received.block(), snapshot);
            } else if (event instanceof RawEvent.FilteredBlockReceived received) {
                dispatchFilteredBlock(received.filteredBlock(), snapshot);
            }
        } catch (RuntimeException e) {
            reportDispatchError(e);
        }
        lastBlockNumber.set(number);
        metrics.onBlockDispatched(number, Duration.ofNanos(System.nanoTime() - start));
    }

    /**
     * Reports a failure to handle a single raw event. The stream stays up; connection
     * subscribers receive {@code ConnectionEvent(true, error)}.
     *
     * @param error the failure
     */
    public void reportDispatchError(final Throwable error) {
        log.error("Failed to dispatch event", error);
        metrics.onDispatchError(error);
        publishConnectionEvent(new ConnectionEvent(true, error));
    }

    /**
     * Offers a connection event to every connection subscriber without waiting.
     *
     * @param event the connection event
     */
    public void publishConnectionEvent(final ConnectionEvent event) {
        for (ConnectionSubscriber subscriber : registry.snapshot().connections()) {
            BoundedEventChannel<ConnectionEvent> channel = subscriber.channel();
            if (channel.offer(event)) {
                metrics.onEventDelivered(EventKind.CONNECTION);
            } else if (!channel.isClosed()) {
                channel.recordDrop();
                metrics.onEventDropped(EventKind.CONNECTION);
                log.warn("Connection event channel full, dropping {}", event);
            }
        }
    }

    /**
     * Returns the block number a resumed stream should start from.
     *
     * @return the block after the last dispatched one, or {@code null} if nothing was dispatched yet
     */
    public @Nullable Long resumeFrom() {
        long last = lastBlockNumber.get();
        return last < 0 ? null : last + 1;
    }

    /**
     * Returns the number of the last dispatched block, or -1.
     */
    public long lastBlockNumber() {
        return lastBlockNumber.get();
    }

    private void dispatchBlock(final Block block, final SubscriberRegistry.Snapshot snapshot)
            throws InterruptedException {
        long number = block.number();
        log.debug("Dispatching block {} ({} transactions)", number, block.transactions().size());

        if (!snapshot.blocks().isEmpty()) {
            BlockEvent event = new BlockEvent(block);
            for (BlockSubscriber subscriber : snapshot.blocks()) {
                if (EventFilters.matchesBlock(subscriber.filter(), block, log)) {
                    deliver(EventKind.BLOCK, subscriber.channel(), event);
                }
            }
        }
        if (!snapshot.filteredBlocks().isEmpty()) {
            deliverFilteredBlock(FilteredBlock.from(block), snapshot.filteredBlocks());
        }
        for (Transaction tx : block.transactions()) {
            deliverTxStatus(tx.txId(), tx.validationCode(), number, snapshot.txStatuses());
            if (tx.isValid()) {
                deliverChaincodeEvents(tx.txId(), tx.chaincodeEvents(), number, snapshot.chaincodes());
            }
        }
    }

    private void dispatchFilteredBlock(final FilteredBlock block, final SubscriberRegistry.Snapshot snapshot)
            throws InterruptedException {
        long number = block.number();
        log.debug("Dispatching filtered block {} ({} transactions)", number, block.filteredTransactions().size());

        if (!snapshot.filteredBlocks().isEmpty()) {
            deliverFilteredBlock(block, snapshot.filteredBlocks());
        }
        for (FilteredTransaction tx : block.filteredTransactions()) {
            deliverTxStatus(tx.txId(), tx.validationCode(), number, snapshot.txStatuses());
            if (tx.isValid()) {
                deliverChaincodeEvents(tx.txId(), tx.chaincodeEvents(), number, snapshot.chaincodes());
            }
        }
    }

    private void deliverFilteredBlock(final FilteredBlock block, final List<FilteredBlockSubscriber> subscribers)
            throws InterruptedException {
        FilteredBlockEvent event = new FilteredBlockEvent(block);
        for (FilteredBlockSubscriber subscriber : subscribers) {
            deliver(EventKind.FILTERED_BLOCK, subscriber.channel(), event);
        }
    }

    private void deliverTxStatus(
            final String txId,
            final TxValidationCode code,
            final long blockNumber,
            final List<TxStatusSubscriber> subscribers) throws InterruptedException {
        for (TxStatusSubscriber subscriber : subscribers) {
            if (EventFilters.matchesTxId(subscriber.txId(), txId)) {
                deliver(EventKind.TX_STATUS, subscriber.channel(), new TxStatusEvent(txId, code, blockNumber));
            }
        }
    }

    private void deliverChaincodeEvents(
            final String txId,
            final List<ChaincodeEvent> events,
            final long blockNumber,
            final List<ChaincodeSubscriber> subscribers) throws InterruptedException {
        if (subscribers.isEmpty()) {
            return;
        }
        for (ChaincodeEvent ccEvent : events) {
            for (ChaincodeSubscriber subscriber : subscribers) {
                if (EventFilters.matchesChaincode(subscriber.chaincodeId(), subscriber.eventNamePattern(), ccEvent)) {
                    deliver(EventKind.CHAINCODE, subscriber.channel(), new CcEvent(
                            txId, ccEvent.chaincodeId(), ccEvent.eventName(), ccEvent.payload(), blockNumber));
                }
            }
        }
    }

    private <T> void deliver(final EventKind kind, final BoundedEventChannel<T> channel, final T event)
            throws InterruptedException {
        boolean accepted;
        switch (policy) {
            case BLOCK -> accepted = channel.put(event);
            case DROP -> accepted = channel.offer(event);
            default -> accepted = channel.offer(event, consumerTimeoutNanos, TimeUnit.NANOSECONDS);
        }
        if (accepted) {
            metrics.onEventDelivered(kind);
            return;
        }
        if (channel.isClosed()) {
            // Unregistered while this pass was in flight
            return;
        }
        channel.recordDrop();
        metrics.onEventDropped(kind);
        log.warn("Subscriber channel full, dropped {} event ({} dropped so far)", kind, channel.droppedCount());
    }
}
