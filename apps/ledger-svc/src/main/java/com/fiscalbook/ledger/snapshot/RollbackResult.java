package com.fiscalbook.ledger.snapshot;

import java.util.UUID;

public record RollbackResult(
        boolean success,
        UUID fiscalBookId,
        UUID restoredFromSnapshot,
        int restoredTransactionCount,
        UUID preRollbackSnapshotId
) {
}
