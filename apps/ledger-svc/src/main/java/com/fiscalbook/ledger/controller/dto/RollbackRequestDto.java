package com.fiscalbook.ledger.controller.dto;

public record RollbackRequestDto(Boolean createPreRollbackSnapshot) {

    public boolean createPreRollbackSnapshotFlag() {
        return createPreRollbackSnapshot == null || createPreRollbackSnapshot;
    }
}
