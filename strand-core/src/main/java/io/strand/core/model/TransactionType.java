// SPDX-License-Identifier: MIT OR Apache-2.0
package io.strand.core.model;

/**
 * Envelope header type of a transaction within a block.
 */
public enum TransactionType {
    MESSAGE(0),
    CONFIG(1),
    CONFIG_UPDATE(2),
    ENDORSER_TRANSACTION(3),
    ORDERER_TRANSACTION(4),
    DELIVER_SEEK_INFO(5),
    CHAINCODE_PACKAGE(6);

    private final int code;

    TransactionType(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static TransactionType fromCode(final int code) {
        for (TransactionType value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + code);
    }
}
