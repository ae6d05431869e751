package com.fiscalbook.ledger.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public record SnapshotTransaction(
        UUID id,
        UUID snapshotId,
        UUID originalTransactionId,
        TransactionData transactionData,
        List<Annotation> annotations,
        Instant copiedAt
) {
    public SnapshotTransaction {
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    public static SnapshotTransaction copyOf(Transaction live, UUID snapshotId, Instant copiedAt) {
        return new SnapshotTransaction(UUID.randomUUID(), snapshotId, live.id(), live.data(), List.of(), copiedAt);
    }

    public SnapshotTransaction withAnnotation(Annotation annotation) {
        List<Annotation> updated = new ArrayList<>(annotations);
        updated.add(annotation);
        return new SnapshotTransaction(id, snapshotId, originalTransactionId, transactionData, updated, copiedAt);
    }
}
