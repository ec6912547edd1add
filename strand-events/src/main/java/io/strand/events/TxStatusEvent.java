// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.events;

import io.strand.core.model.TxValidationCode;
import java.util.Objects;

/**
 * Commit outcome of one transaction.
 *
 * @param txId             the transaction id
 * @param txValidationCode the validation code the committing peer assigned
 * @param blockNumber      the number of the block containing the transaction
 */
public record TxStatusEvent(String txId, TxValidationCode txValidationCode, long blockNumber) {

    public TxStatusEvent {
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(txValidationCode, "txValidationCode");
    }
}
