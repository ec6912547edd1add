// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A named event emitted by chaincode while executing a transaction.
 *
 * <p>
 * Events taken from a filtered block carry an empty payload.
 *
 * @param chaincodeId the id of the chaincode that emitted the event
 * @param txId        the id of the emitting transaction
 * @param eventName   the application-defined event name
 * @param payload     the event payload (copied on the way in and out)
 */
public record ChaincodeEvent(String chaincodeId, String txId, String eventName, byte[] payload) {

    private static final byte[] EMPTY = new byte[0];

    public ChaincodeEvent {
        Objects.requireNonNull(chaincodeId, "chaincodeId");
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(eventName, "eventName");
        payload = payload == null ? EMPTY : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Returns a copy of this event without its payload, as carried by filtered blocks.
     *
     * @return the payload-free event
     */
    public ChaincodeEvent withoutPayload() {
        return new ChaincodeEvent(chaincodeId, txId, eventName, EMPTY);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChaincodeEvent other)) {
            return false;
        }
        return chaincodeId.equals(other.chaincodeId)
                && txId.equals(other.txId)
                && eventName.equals(other.eventName)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(chaincodeId, txId, eventName) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ChaincodeEvent[chaincodeId=" + chaincodeId
                + ", txId=" + txId
                + ", eventName=" + eventName
                + ", payloadSize=" + payload.length + "]";
    }
}
