package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.model.FiscalBook;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotSchedule;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.Transaction;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Whole-store state of the in-memory ledger. Values are immutable records, so copying the maps is a full copy.
 */
final class InMemoryLedgerState {

    final Map<UUID, FiscalBook> books;
    final Map<UUID, Transaction> transactions;
    final Map<UUID, FiscalBookSnapshot> snapshots;
    final Map<UUID, SnapshotTransaction> snapshotTransactions;
    final Map<UUID, SnapshotSchedule> schedulesByBook;

    InMemoryLedgerState() {
        this(new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    private InMemoryLedgerState(
            Map<UUID, FiscalBook> books,
            Map<UUID, Transaction> transactions,
            Map<UUID, FiscalBookSnapshot> snapshots,
            Map<UUID, SnapshotTransaction> snapshotTransactions,
            Map<UUID, SnapshotSchedule> schedulesByBook
    ) {
        this.books = books;
        this.transactions = transactions;
        this.snapshots = snapshots;
        this.snapshotTransactions = snapshotTransactions;
        this.schedulesByBook = schedulesByBook;
    }

    InMemoryLedgerState copy() {
        return new InMemoryLedgerState(
                new LinkedHashMap<>(books),
                new LinkedHashMap<>(transactions),
                new LinkedHashMap<>(snapshots),
                new LinkedHashMap<>(snapshotTransactions),
                new LinkedHashMap<>(schedulesByBook)
        );
    }
}
