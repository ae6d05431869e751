package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.model.SnapshotStatistics;
import com.fiscalbook.ledger.model.SnapshotStatistics.StatisticsDelta;
import com.fiscalbook.ledger.model.TransactionData;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot against live state, bucketed by original transaction id.
 */
public record SnapshotComparison(
        UUID snapshotId,
        String snapshotName,
        Instant snapshotDate,
        UUID fiscalBookId,
        List<TransactionEntry> added,
        List<TransactionEntry> removed,
        List<ModifiedTransaction> modified,
        List<TransactionEntry> unchanged,
        Counts counts,
        Summary summary
) {

    public record TransactionEntry(UUID id, TransactionData transaction) {
    }

    public record ModifiedTransaction(
            UUID id,
            TransactionData original,
            TransactionData current,
            List<FieldChange> changes
    ) {
    }

    public record FieldChange(String field, String oldValue, String newValue) {
    }

    public record Counts(int added, int removed, int modified, int unchanged) {
    }

    public record Summary(
            SnapshotStatistics snapshotStats,
            SnapshotStatistics currentStats,
            StatisticsDelta differences
    ) {
    }
}
