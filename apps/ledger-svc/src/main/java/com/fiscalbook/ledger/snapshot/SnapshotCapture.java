package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.model.CreationSource;
import com.fiscalbook.ledger.model.FiscalBook;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotStatistics;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.Transaction;
import com.fiscalbook.ledger.repository.FiscalBookRepository;
import com.fiscalbook.ledger.repository.SnapshotStore;
import com.fiscalbook.ledger.repository.TransactionRepository;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Materialises a snapshot of a book's current header and transactions. The header and every
 * transaction copy are written in one unit of work, so a failure leaves nothing behind.
 */
@Service
public class SnapshotCapture {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCapture.class);

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final FiscalBookRepository fiscalBookRepository;
    private final TransactionRepository transactionRepository;
    private final SnapshotStore snapshotStore;
    private final BookLockRegistry bookLocks;
    private final Clock clock;

    @Autowired
    public SnapshotCapture(UnitOfWorkRunner unitOfWorkRunner,
                           FiscalBookRepository fiscalBookRepository,
                           TransactionRepository transactionRepository,
                           SnapshotStore snapshotStore,
                           BookLockRegistry bookLocks) {
        this(unitOfWorkRunner, fiscalBookRepository, transactionRepository, snapshotStore, bookLocks, Clock.systemUTC());
    }

    SnapshotCapture(UnitOfWorkRunner unitOfWorkRunner,
                    FiscalBookRepository fiscalBookRepository,
                    TransactionRepository transactionRepository,
                    SnapshotStore snapshotStore,
                    BookLockRegistry bookLocks,
                    Clock clock) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.fiscalBookRepository = fiscalBookRepository;
        this.transactionRepository = transactionRepository;
        this.snapshotStore = snapshotStore;
        this.bookLocks = bookLocks;
        this.clock = clock;
    }

    public FiscalBookSnapshot capture(UUID fiscalBookId, CaptureRequest request) {
        return bookLocks.withLock(fiscalBookId, () -> unitOfWorkRunner.inTransaction(uow -> {
            FiscalBook book = fiscalBookRepository.findById(uow, fiscalBookId)
                    .orElseThrow(() -> ResourceNotFoundException.fiscalBook(fiscalBookId));
            List<Transaction> transactions = transactionRepository.findByFiscalBookId(uow, fiscalBookId);
            Instant now = clock.instant();

            FiscalBookSnapshot snapshot = snapshotStore.saveSnapshot(uow, new FiscalBookSnapshot(
                    UUID.randomUUID(),
                    fiscalBookId,
                    nameOrDefault(request.name(), now),
                    request.description(),
                    request.creationSource() != null ? request.creationSource() : CreationSource.MANUAL,
                    request.tags(),
                    false,
                    List.of(),
                    book.descriptiveData(),
                    SnapshotStatistics.of(transactions),
                    now
            ));

            if (!transactions.isEmpty()) {
                List<SnapshotTransaction> copies = transactions.stream()
                        .map(tx -> SnapshotTransaction.copyOf(tx, snapshot.id(), now))
                        .toList();
                snapshotStore.saveSnapshotTransactions(uow, copies);
            }

            log.info("Snapshot {} captured for fiscal book {} ({} transactions, source={})",
                    snapshot.id(), fiscalBookId, transactions.size(), snapshot.creationSource().value());
            return snapshot;
        }));
    }

    static String nameOrDefault(String name, Instant now) {
        if (name != null && !name.isBlank()) {
            return name.trim();
        }
        return "Snapshot " + LocalDate.ofInstant(now, ZoneOffset.UTC);
    }
}
