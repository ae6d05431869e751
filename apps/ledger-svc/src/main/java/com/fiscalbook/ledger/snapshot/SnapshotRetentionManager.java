package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.config.FiscalbookProperties;
import com.fiscalbook.ledger.repository.SnapshotStore;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the newest {@code retentionCount} unprotected scheduled snapshots of a book and deletes the rest,
 * one unit of work per snapshot.
 */
@Component
public class SnapshotRetentionManager {

    private static final Logger log = LoggerFactory.getLogger(SnapshotRetentionManager.class);

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final SnapshotStore snapshotStore;
    private final BookLockRegistry bookLocks;
    private final int defaultRetentionCount;

    public SnapshotRetentionManager(UnitOfWorkRunner unitOfWorkRunner,
                                    SnapshotStore snapshotStore,
                                    BookLockRegistry bookLocks,
                                    FiscalbookProperties properties) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.snapshotStore = snapshotStore;
        this.bookLocks = bookLocks;
        this.defaultRetentionCount = properties.snapshots().defaultRetentionCount();
    }

    public int cleanup(UUID fiscalBookId) {
        return cleanup(fiscalBookId, defaultRetentionCount);
    }

    /**
     * @return number of snapshots actually deleted
     */
    public int cleanup(UUID fiscalBookId, int retentionCount) {
        if (retentionCount <= 0) {
            throw new IllegalArgumentException("retentionCount must be positive");
        }
        return bookLocks.withLock(fiscalBookId, () -> {
            List<UUID> candidates = unitOfWorkRunner.readOnly(
                    uow -> snapshotStore.findSnapshotsToCleanup(uow, fiscalBookId, retentionCount));
            int deleted = 0;
            for (UUID snapshotId : candidates) {
                try {
                    boolean removed = unitOfWorkRunner.inTransaction(
                            uow -> snapshotStore.deleteSnapshot(uow, snapshotId).isPresent());
                    if (removed) {
                        deleted++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Retention could not delete snapshot {} of fiscal book {}: {}", snapshotId, fiscalBookId, e.getMessage());
                }
            }
            if (deleted > 0) {
                log.info("Retention removed {} scheduled snapshot(s) of fiscal book {} (keeping {})", deleted, fiscalBookId, retentionCount);
            }
            return deleted;
        });
    }
}
