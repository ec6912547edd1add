// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import java.util.Arrays;
import java.util.Objects;

/**
 * A chaincode event delivered to a chaincode-event subscriber.
 *
 * <p>
 * The payload is empty when the event was taken from a filtered block.
 *
 * @param txId        the id of the emitting transaction
 * @param chaincodeId the id of the emitting chaincode
 * @param eventName   the event name
 * @param payload     the event payload (copied on the way in and out)
 * @param blockNumber the number of the block containing the transaction
 */
public record CcEvent(String txId, String chaincodeId, String eventName, byte[] payload, long blockNumber) {

    public CcEvent {
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(chaincodeId, "chaincodeId");
        Objects.requireNonNull(eventName, "eventName");
        payload = payload == null ? new byte[0] : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CcEvent other)) {
            return false;
        }
        return blockNumber == other.blockNumber
                && txId.equals(other.txId)
                && chaincodeId.equals(other.chaincodeId)
                && eventName.equals(other.eventName)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(txId, chaincodeId, eventName, blockNumber) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "CcEvent[txId=" + txId
                + ", chaincodeId=" + chaincodeId
                + ", eventName=" + eventName
                + ", payloadSize=" + payload.length
                + ", blockNumber=" + blockNumber + "]";
    }
}
