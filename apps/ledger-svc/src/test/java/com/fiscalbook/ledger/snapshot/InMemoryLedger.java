package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.MutableClock;
import com.fiscalbook.ledger.config.FiscalbookProperties;
import com.fiscalbook.ledger.model.FiscalBook;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.Transaction;
import com.fiscalbook.ledger.repository.FiscalBookRepository;
import com.fiscalbook.ledger.repository.InMemoryFiscalBookRepository;
import com.fiscalbook.ledger.repository.InMemorySnapshotStore;
import com.fiscalbook.ledger.repository.InMemoryTransactionRepository;
import com.fiscalbook.ledger.repository.InMemoryUnitOfWorkRunner;
import com.fiscalbook.ledger.repository.SnapshotStore;
import com.fiscalbook.ledger.repository.TransactionRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot components wired over the in-memory store, sharing one controllable clock.
 */
final class InMemoryLedger {

    // a Monday
    static final Instant START = Instant.parse("2024-03-04T10:00:00Z");

    final MutableClock clock = new MutableClock(START);
    final InMemoryUnitOfWorkRunner runner = new InMemoryUnitOfWorkRunner();
    final FiscalBookRepository books = new InMemoryFiscalBookRepository();
    final TransactionRepository transactions;
    final SnapshotStore store;
    final BookLockRegistry locks = new BookLockRegistry();
    final FiscalbookProperties properties;

    final SnapshotCapture capture;
    final SnapshotRetentionManager retention;
    final ScheduleEngine scheduleEngine;
    final SnapshotService snapshotService;
    final SnapshotComparator comparator;
    final RollbackCoordinator rollbackCoordinator;

    InMemoryLedger() {
        this(new InMemorySnapshotStore(), new InMemoryTransactionRepository(), new FiscalbookProperties(null));
    }

    InMemoryLedger(SnapshotStore store, TransactionRepository transactions, FiscalbookProperties properties) {
        this.store = store;
        this.transactions = transactions;
        this.properties = properties;
        this.capture = new SnapshotCapture(runner, books, transactions, store, locks, clock);
        this.retention = new SnapshotRetentionManager(runner, store, locks, properties);
        this.scheduleEngine = new ScheduleEngine(runner, books, store, capture, retention, properties, clock);
        this.snapshotService = new SnapshotService(runner, store, properties, clock);
        this.comparator = new SnapshotComparator(runner, store, transactions);
        this.rollbackCoordinator = new RollbackCoordinator(runner, books, transactions, store, capture, locks, clock);
    }

    FiscalBook seed(FiscalBook book, Transaction... live) {
        return runner.inTransaction(uow -> {
            FiscalBook saved = books.save(uow, book);
            transactions.saveAll(uow, List.of(live));
            return saved;
        });
    }

    FiscalBook book(UUID bookId) {
        return runner.readOnly(uow -> books.findById(uow, bookId)).orElseThrow();
    }

    List<Transaction> liveTransactions(UUID bookId) {
        return runner.readOnly(uow -> transactions.findByFiscalBookId(uow, bookId));
    }

    List<FiscalBookSnapshot> snapshots(UUID bookId) {
        return runner.readOnly(uow -> store.findAllSnapshotsByFiscalBook(uow, bookId));
    }

    List<SnapshotTransaction> copies(UUID snapshotId) {
        return runner.readOnly(uow -> store.findSnapshotTransactions(uow, snapshotId));
    }
}
