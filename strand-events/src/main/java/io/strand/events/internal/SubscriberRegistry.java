// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events.internal;

import io.strand.core.InternalApi;
import io.strand.core.error.ServiceClosedException;
import io.strand.events.Registration;
import io.strand.events.internal.Subscriber.BlockSubscriber;
import io.strand.events.internal.Subscriber.ChaincodeSubscriber;
import io.strand.events.internal.Subscriber.ConnectionSubscriber;
import io.strand.events.internal.Subscriber.FilteredBlockSubscriber;
import io.strand.events.internal.Subscriber.TxStatusSubscriber;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thread-safe store of subscriber records keyed by registration handle.
 *
 * <p>
 * Records live in an arena of slots. A handle is the slot index plus the slot's
 * generation at insert time; removing a record bumps the generation, so a stale
 * handle can never address the slot's next occupant. Lookup and removal are O(1).
 *
 * <p>
 * Mutations are serialized on one lock and each one publishes a fresh immutable
 * {@link Snapshot} through a volatile field. Readers never take the lock: a
 * dispatch pass sees either the membership before a mutation or after it.
 */
@InternalApi
public final class SubscriberRegistry {

    private static final int INITIAL_SLOTS = 16;

    private final Object lock = new Object();
    private Slot[] slots = new Slot[INITIAL_SLOTS];
    private int highWater;
    private final ArrayDeque<Integer> freeSlots = new ArrayDeque<>();
    private int size;
    private boolean sealed;
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * Adds a subscriber.
     *
     * @param subscriber the record to store
     * @return the handle identifying the record
     * @throws ServiceClosedException if the registry has been sealed
     */
    public Registration insert(final Subscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        synchronized (lock) {
            if (sealed) {
                throw new ServiceClosedException("Event service is closed");
            }
            int index = allocateSlot();
            Slot slot = slots[index];
            slot.subscriber = subscriber;
            size++;
            publish();
            return new SlotHandle(this, index, slot.generation);
        }
    }

    /**
     * Removes the record addressed by a handle.
     *
     * @param registration the handle
     * @return the removed record, or {@code null} if the handle is unknown, foreign or stale
     */
    public @Nullable Subscriber remove(final Registration registration) {
        if (!(registration instanceof SlotHandle handle) || handle.owner() != this) {
            return null;
        }
        synchronized (lock) {
            Slot slot = liveSlot(handle);
            if (slot == null) {
                return null;
            }
            Subscriber removed = slot.subscriber;
            slot.subscriber = null;
            slot.generation++;
            freeSlots.push(handle.index());
            size--;
            publish();
            return removed;
        }
    }

    /**
     * Returns whether a handle still addresses a live record.
     */
    public boolean contains(final Registration registration) {
        if (!(registration instanceof SlotHandle handle) || handle.owner() != this) {
            return false;
        }
        synchronized (lock) {
            return liveSlot(handle) != null;
        }
    }

    /**
     * Returns the current immutable membership snapshot.
     */
    public Snapshot snapshot() {
        return snapshot;
    }

    public int size() {
        synchronized (lock) {
            return size;
        }
    }

    public boolean isSealed() {
        synchronized (lock) {
            return sealed;
        }
    }

    /**
     * Seals the registry if, and only if, it is empty. Check and seal are atomic with
     * respect to {@link #insert}: a concurrent insert either lands first (and this
     * returns {@code false}) or fails with {@link ServiceClosedException}.
     *
     * @return {@code true} if the registry was empty and is now sealed
     */
    public boolean sealIfEmpty() {
        synchronized (lock) {
            if (size > 0) {
                return false;
            }
            sealed = true;
            return true;
        }
    }

    /**
     * Seals the registry and removes every remaining record.
     *
     * @return the removed records; each is returned by exactly one call of this method or {@link #remove}
     */
    public List<Subscriber> closeAll() {
        synchronized (lock) {
            sealed = true;
            List<Subscriber> removed = new ArrayList<>(size);
            for (int i = 0; i < highWater; i++) {
                Slot slot = slots[i];
                if (slot.subscriber != null) {
                    removed.add(slot.subscriber);
                    slot.subscriber = null;
                    slot.generation++;
                    freeSlots.push(i);
                }
            }
            size = 0;
            publish();
            return removed;
        }
    }

    private int allocateSlot() {
        Integer free = freeSlots.poll();
        if (free != null) {
            return free;
        }
        if (highWater == slots.length) {
            slots = Arrays.copyOf(slots, slots.length * 2);
        }
        slots[highWater] = new Slot();
        return highWater++;
    }

    private @Nullable Slot liveSlot(final SlotHandle handle) {
        if (handle.index() < 0 || handle.index() >= highWater) {
            return null;
        }
        Slot slot = slots[handle.index()];
        if (slot.subscriber == null || slot.generation != handle.generation()) {
            return null;
        }
        return slot;
    }

    private void publish() {
        List<BlockSubscriber> blocks = new ArrayList<>();
        List<FilteredBlockSubscriber> filteredBlocks = new ArrayList<>();
        List<ChaincodeSubscriber> chaincodes = new ArrayList<>();
        List<TxStatusSubscriber> txStatuses = new ArrayList<>();
        List<ConnectionSubscriber> connections = new ArrayList<>();
        for (int i = 0; i < highWater; i++) {
            Subscriber s = slots[i].subscriber;
            if (s instanceof BlockSubscriber b) {
                blocks.add(b);
            } else if (s instanceof FilteredBlockSubscriber f) {
                filteredBlocks.add(f);
            } else if (s instanceof ChaincodeSubscriber c) {
                chaincodes.add(c);
            } else if (s instanceof TxStatusSubscriber t) {
                txStatuses.add(t);
            } else if (s instanceof ConnectionSubscriber c) {
                connections.add(c);
            }
        }
        snapshot = new Snapshot(blocks, filteredBlocks, chaincodes, txStatuses, connections);
    }

    private static final class Slot {
        private long generation;
        private @Nullable Subscriber subscriber;
    }

    /**
     * Handle handed out for one inserted record.
     */
    record SlotHandle(SubscriberRegistry owner, int index, long generation) implements Registration {
        @Override
        public boolean equals(final Object o) {
            return o instanceof SlotHandle other
                    && owner == other.owner
                    && index == other.index
                    && generation == other.generation;
        }

        @Override
        public int hashCode() {
            return 31 * (31 * System.identityHashCode(owner) + index) + Long.hashCode(generation);
        }

        @Override
        public String toString() {
            return "Registration[slot=" + index + ", generation=" + generation + "]";
        }
    }

    /**
     * Immutable membership view, grouped by subscriber kind.
     */
    public record Snapshot(
            List<BlockSubscriber> blocks,
            List<FilteredBlockSubscriber> filteredBlocks,
            List<ChaincodeSubscriber> chaincodes,
            List<TxStatusSubscriber> txStatuses,
            List<ConnectionSubscriber> connections) {

        static final Snapshot EMPTY = new Snapshot(List.of(), List.of(), List.of(), List.of(), List.of());

        public Snapshot {
            blocks = List.copyOf(blocks);
            filteredBlocks = List.copyOf(filteredBlocks);
            chaincodes = List.copyOf(chaincodes);
            txStatuses = List.copyOf(txStatuses);
            connections = List.copyOf(connections);
        }

        public int size() {
            return blocks.size() + filteredBlocks.size() + chaincodes.size() + txStatuses.size() + connections.size();
        }
    }
}
