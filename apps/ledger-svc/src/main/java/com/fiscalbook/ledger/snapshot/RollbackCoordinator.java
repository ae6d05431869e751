package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.model.CreationSource;
import com.fiscalbook.ledger.model.FiscalBook;
import com.fiscalbook.ledger.model.FiscalBookData;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.FiscalBookStatus;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.Transaction;
import com.fiscalbook.ledger.repository.FiscalBookRepository;
import com.fiscalbook.ledger.repository.SnapshotStore;
import com.fiscalbook.ledger.repository.TransactionRepository;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Restores books from snapshots.
 *
 * <p>{@link #cloneToNewBook} writes a new, independent book in one unit of work. {@link #rollback} is
 * destructive and two-phase: the optional safety snapshot commits on its own before the book's
 * transactions and header are replaced in a second unit. A failure in the second phase leaves the
 * safety snapshot in place.
 */
@Service
public class RollbackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RollbackCoordinator.class);

    static final List<String> PRE_ROLLBACK_TAGS = List.of("pre-rollback", "auto");

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final FiscalBookRepository fiscalBookRepository;
    private final TransactionRepository transactionRepository;
    private final SnapshotStore snapshotStore;
    private final SnapshotCapture snapshotCapture;
    private final BookLockRegistry bookLocks;
    private final Clock clock;

    @Autowired
    public RollbackCoordinator(UnitOfWorkRunner unitOfWorkRunner,
                               FiscalBookRepository fiscalBookRepository,
                               TransactionRepository transactionRepository,
                               SnapshotStore snapshotStore,
                               SnapshotCapture snapshotCapture,
                               BookLockRegistry bookLocks) {
        this(unitOfWorkRunner, fiscalBookRepository, transactionRepository, snapshotStore, snapshotCapture, bookLocks, Clock.systemUTC());
    }

    RollbackCoordinator(UnitOfWorkRunner unitOfWorkRunner,
                        FiscalBookRepository fiscalBookRepository,
                        TransactionRepository transactionRepository,
                        SnapshotStore snapshotStore,
                        SnapshotCapture snapshotCapture,
                        BookLockRegistry bookLocks,
                        Clock clock) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.fiscalBookRepository = fiscalBookRepository;
        this.transactionRepository = transactionRepository;
        this.snapshotStore = snapshotStore;
        this.snapshotCapture = snapshotCapture;
        this.bookLocks = bookLocks;
        this.clock = clock;
    }

    public FiscalBook cloneToNewBook(UUID snapshotId, CloneOverrides overrides) {
        CloneOverrides requested = overrides != null ? overrides : CloneOverrides.none();
        FiscalBook clone = unitOfWorkRunner.inTransaction(uow -> {
            FiscalBookSnapshot snapshot = snapshotStore.findSnapshotById(uow, snapshotId)
                    .orElseThrow(() -> ResourceNotFoundException.snapshot(snapshotId));
            List<SnapshotTransaction> copies = snapshotStore.findSnapshotTransactions(uow, snapshotId);
            FiscalBookData recorded = snapshot.fiscalBookData();
            Instant now = clock.instant();

            FiscalBook book = fiscalBookRepository.save(uow, new FiscalBook(
                    UUID.randomUUID(),
                    pick(requested.bookName(), recorded.bookName() + " (Copy)"),
                    pick(requested.bookType(), recorded.bookType()),
                    pick(requested.bookPeriod(), recorded.bookPeriod()),
                    pick(requested.reference(), recorded.reference()),
                    FiscalBookStatus.OPEN,
                    requested.fiscalData() != null ? requested.fiscalData() : recorded.fiscalData(),
                    requested.companyId() != null ? requested.companyId() : recorded.companyId(),
                    pick(requested.notes(), recorded.notes()),
                    now,
                    now,
                    null
            ));
            transactionRepository.saveAll(uow, freshTransactions(copies, book.id()));
            return book;
        });
        log.info("Snapshot {} cloned into new fiscal book {}", snapshotId, clone.id());
        return clone;
    }

    public RollbackResult rollback(UUID snapshotId, boolean createPreRollbackSnapshot) {
        FiscalBookSnapshot target = unitOfWorkRunner.readOnly(uow -> snapshotStore.findSnapshotById(uow, snapshotId))
                .orElseThrow(() -> ResourceNotFoundException.snapshot(snapshotId));
        UUID bookId = target.originalFiscalBookId();

        return bookLocks.withLock(bookId, () -> {
            boolean bookExists = unitOfWorkRunner.readOnly(uow -> fiscalBookRepository.findById(uow, bookId).isPresent());
            if (!bookExists) {
                throw ResourceNotFoundException.fiscalBook(bookId);
            }

            UUID preRollbackSnapshotId = null;
            if (createPreRollbackSnapshot) {
                FiscalBookSnapshot safety = snapshotCapture.capture(bookId, new CaptureRequest(
                        "Pre-rollback " + clock.instant(),
                        "Auto-created before rollback to snapshot \"" + target.snapshotName() + "\"",
                        PRE_ROLLBACK_TAGS,
                        CreationSource.MANUAL
                ));
                preRollbackSnapshotId = safety.id();
            }

            int restored = unitOfWorkRunner.inTransaction(uow -> {
                FiscalBook book = fiscalBookRepository.findById(uow, bookId)
                        .orElseThrow(() -> ResourceNotFoundException.fiscalBook(bookId));
                List<SnapshotTransaction> copies = snapshotStore.findSnapshotTransactions(uow, snapshotId);
                int removed = transactionRepository.deleteByFiscalBookId(uow, bookId);
                transactionRepository.saveAll(uow, freshTransactions(copies, bookId));
                fiscalBookRepository.save(uow, book.restoredFrom(target.fiscalBookData(), clock.instant()));
                log.info("Fiscal book {} rolled back to snapshot {}: {} transactions removed, {} restored",
                        bookId, snapshotId, removed, copies.size());
                return copies.size();
            });

            return new RollbackResult(true, bookId, snapshotId, restored, preRollbackSnapshotId);
        });
    }

    private static List<Transaction> freshTransactions(List<SnapshotTransaction> copies, UUID bookId) {
        return copies.stream()
                .map(copy -> Transaction.copyOf(copy.transactionData(), bookId))
                .toList();
    }

    private static String pick(String override, String recorded) {
        return override != null && !override.isBlank() ? override : recorded;
    }
}
