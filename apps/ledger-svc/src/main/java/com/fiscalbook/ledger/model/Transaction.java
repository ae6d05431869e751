package com.fiscalbook.ledger.model;

import java.util.UUID;

public record Transaction(
        UUID id,
        UUID fiscalBookId,
        TransactionData data
) {
    public Transaction withData(TransactionData newData) {
        return new Transaction(id, fiscalBookId, newData);
    }

    /**
     * A fresh transaction with a new identity, linked to {@code bookId}.
     */
    public static Transaction copyOf(TransactionData data, UUID bookId) {
        return new Transaction(UUID.randomUUID(), bookId, data);
    }
}
