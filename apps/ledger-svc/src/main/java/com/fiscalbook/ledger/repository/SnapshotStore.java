package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotSchedule;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.SnapshotUpdate;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence contract for snapshot headers, their transaction copies and per-book schedules.
 * Implementations refuse to delete a protected snapshot on every delete path.
 */
public interface SnapshotStore {

    record PageResult<T>(List<T> items, long total) {}

    FiscalBookSnapshot saveSnapshot(UnitOfWork uow, FiscalBookSnapshot snapshot);

    void saveSnapshotTransactions(UnitOfWork uow, List<SnapshotTransaction> copies);

    Optional<FiscalBookSnapshot> findSnapshotById(UnitOfWork uow, UUID snapshotId);

    /**
     * Newest first; {@code tags} must all be present on a snapshot for it to match.
     */
    PageResult<FiscalBookSnapshot> findSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId, List<String> tags, int limit, int skip);

    List<FiscalBookSnapshot> findAllSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId);

    Optional<FiscalBookSnapshot> updateSnapshot(UnitOfWork uow, UUID snapshotId, SnapshotUpdate update);

    /**
     * Deletes the header and its transaction copies.
     *
     * @return the deleted header, or empty when it did not exist
     * @throws com.fiscalbook.ledger.exception.ProtectedResourceException when the snapshot is protected
     */
    Optional<FiscalBookSnapshot> deleteSnapshot(UnitOfWork uow, UUID snapshotId);

    /**
     * Deletes every snapshot of the book with its copies. Refuses the whole batch if any is protected.
     */
    int deleteSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId);

    /**
     * Unprotected scheduled snapshots of the book, newest first, past the first {@code retentionCount}.
     */
    List<UUID> findSnapshotsToCleanup(UnitOfWork uow, UUID fiscalBookId, int retentionCount);

    /**
     * Newest transaction date first, undated copies last.
     */
    List<SnapshotTransaction> findSnapshotTransactions(UnitOfWork uow, UUID snapshotId);

    /**
     * Same order as the unpaged variant.
     */
    PageResult<SnapshotTransaction> findSnapshotTransactions(UnitOfWork uow, UUID snapshotId, int limit, int skip);

    Optional<SnapshotTransaction> findSnapshotTransactionById(UnitOfWork uow, UUID snapshotTransactionId);

    SnapshotTransaction saveSnapshotTransaction(UnitOfWork uow, SnapshotTransaction copy);

    Optional<SnapshotSchedule> findSchedule(UnitOfWork uow, UUID fiscalBookId);

    /**
     * Upsert keyed by the schedule's fiscal book id.
     */
    SnapshotSchedule saveSchedule(UnitOfWork uow, SnapshotSchedule schedule);

    boolean deleteSchedule(UnitOfWork uow, UUID fiscalBookId);

    /**
     * Enabled schedules whose next execution is at or before {@code now}.
     */
    List<SnapshotSchedule> findDueSchedules(UnitOfWork uow, Instant now);
}
