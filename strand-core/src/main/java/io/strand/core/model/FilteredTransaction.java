// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Validation result of a single transaction without its payload.
 *
 * @param txId            the transaction id
 * @param type            the envelope header type
 * @param validationCode  the commit outcome
 * @param chaincodeEvents chaincode events without payloads
 */
public record FilteredTransaction(
        String txId,
        TransactionType type,
        TxValidationCode validationCode,
        List<ChaincodeEvent> chaincodeEvents) {

    public FilteredTransaction {
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(validationCode, "validationCode");
        chaincodeEvents = chaincodeEvents == null
                ? List.of()
                : chaincodeEvents.stream().map(ChaincodeEvent::withoutPayload).toList();
    }

    public boolean isValid() {
        return validationCode.isValid();
    }
}
