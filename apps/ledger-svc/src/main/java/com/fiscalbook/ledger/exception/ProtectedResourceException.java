package com.fiscalbook.ledger.exception;

import java.util.UUID;

/**
 * Raised when a delete targets a protected snapshot. Protection has to be removed explicitly first.
 */
public class ProtectedResourceException extends RuntimeException {

    private final UUID snapshotId;

    public ProtectedResourceException(UUID snapshotId) {
        super("Cannot delete protected snapshot " + snapshotId + ". Remove protection first.");
        this.snapshotId = snapshotId;
    }

    public UUID getSnapshotId() {
        return snapshotId;
    }
}
