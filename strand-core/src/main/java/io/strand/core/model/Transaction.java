// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A committed transaction inside a {@link Block}.
 *
 * @param txId            the transaction id
 * @param type            the envelope header type
 * @param validationCode  the commit outcome
 * @param chaincodeEvents the chaincode events recorded in the transaction's read/write set metadata
 */
public record Transaction(
        String txId,
        TransactionType type,
        TxValidationCode validationCode,
        List<ChaincodeEvent> chaincodeEvents) {

    public Transaction {
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(validationCode, "validationCode");
        chaincodeEvents = chaincodeEvents == null ? List.of() : List.copyOf(chaincodeEvents);
    }

    public boolean isValid() {
        return validationCode.isValid();
    }
}
