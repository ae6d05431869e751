package com.fiscalbook.ledger.snapshot;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ScheduleExecutionResult(List<Executed> executed, List<Failure> errors) {

    public ScheduleExecutionResult {
        executed = List.copyOf(executed);
        errors = List.copyOf(errors);
    }

    public record Executed(UUID fiscalBookId, UUID snapshotId, Instant nextExecutionAt) {
    }

    public record Failure(UUID fiscalBookId, String error) {
    }
}
