package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.exception.ProtectedResourceException;
import com.fiscalbook.ledger.model.CreationSource;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotSchedule;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.SnapshotUpdate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

@Repository
@Profile("memory")
public class InMemorySnapshotStore implements SnapshotStore {

    private static final Comparator<FiscalBookSnapshot> NEWEST_FIRST =
            Comparator.comparing(FiscalBookSnapshot::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private static final Comparator<SnapshotTransaction> NEWEST_TRANSACTION_FIRST = Comparator.comparing(
            (SnapshotTransaction copy) -> copy.transactionData() == null ? null : copy.transactionData().transactionDate(),
            Comparator.nullsLast(Comparator.reverseOrder())
    );

    @Override
    public FiscalBookSnapshot saveSnapshot(UnitOfWork uow, FiscalBookSnapshot snapshot) {
        InMemoryUnitOfWork.write(uow).snapshots.put(snapshot.id(), snapshot);
        return snapshot;
    }

    @Override
    public void saveSnapshotTransactions(UnitOfWork uow, List<SnapshotTransaction> copies) {
        var storage = InMemoryUnitOfWork.write(uow).snapshotTransactions;
        copies.forEach(copy -> storage.put(copy.id(), copy));
    }

    @Override
    public Optional<FiscalBookSnapshot> findSnapshotById(UnitOfWork uow, UUID snapshotId) {
        return Optional.ofNullable(InMemoryUnitOfWork.read(uow).snapshots.get(snapshotId));
    }

    @Override
    public PageResult<FiscalBookSnapshot> findSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId, List<String> tags, int limit, int skip) {
        List<String> required = tags == null ? List.of() : tags;
        List<FiscalBookSnapshot> matching = snapshotsOf(InMemoryUnitOfWork.read(uow), fiscalBookId).stream()
                .filter(snapshot -> snapshot.hasAllTags(required))
                .collect(Collectors.toList());
        return new PageResult<>(page(matching, limit, skip), matching.size());
    }

    @Override
    public List<FiscalBookSnapshot> findAllSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId) {
        return snapshotsOf(InMemoryUnitOfWork.read(uow), fiscalBookId);
    }

    @Override
    public Optional<FiscalBookSnapshot> updateSnapshot(UnitOfWork uow, UUID snapshotId, SnapshotUpdate update) {
        var storage = InMemoryUnitOfWork.write(uow).snapshots;
        FiscalBookSnapshot existing = storage.get(snapshotId);
        if (existing == null) {
            return Optional.empty();
        }
        FiscalBookSnapshot updated = existing.apply(update);
        storage.put(snapshotId, updated);
        return Optional.of(updated);
    }

    @Override
    public Optional<FiscalBookSnapshot> deleteSnapshot(UnitOfWork uow, UUID snapshotId) {
        InMemoryLedgerState state = InMemoryUnitOfWork.write(uow);
        FiscalBookSnapshot existing = state.snapshots.get(snapshotId);
        if (existing == null) {
            return Optional.empty();
        }
        if (existing.isProtected()) {
            throw new ProtectedResourceException(snapshotId);
        }
        state.snapshotTransactions.values().removeIf(copy -> copy.snapshotId().equals(snapshotId));
        state.snapshots.remove(snapshotId);
        return Optional.of(existing);
    }

    @Override
    public int deleteSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId) {
        InMemoryLedgerState state = InMemoryUnitOfWork.write(uow);
        List<FiscalBookSnapshot> snapshots = snapshotsOf(state, fiscalBookId);
        snapshots.stream()
                .filter(FiscalBookSnapshot::isProtected)
                .findFirst()
                .ifPresent(snapshot -> {
                    throw new ProtectedResourceException(snapshot.id());
                });
        List<UUID> ids = snapshots.stream().map(FiscalBookSnapshot::id).toList();
        state.snapshotTransactions.values().removeIf(copy -> ids.contains(copy.snapshotId()));
        ids.forEach(state.snapshots::remove);
        return ids.size();
    }

    @Override
    public List<UUID> findSnapshotsToCleanup(UnitOfWork uow, UUID fiscalBookId, int retentionCount) {
        return snapshotsOf(InMemoryUnitOfWork.read(uow), fiscalBookId).stream()
                .filter(snapshot -> snapshot.creationSource() == CreationSource.SCHEDULED)
                .filter(snapshot -> !snapshot.isProtected())
                .skip(Math.max(retentionCount, 0))
                .map(FiscalBookSnapshot::id)
                .toList();
    }

    @Override
    public List<SnapshotTransaction> findSnapshotTransactions(UnitOfWork uow, UUID snapshotId) {
        return InMemoryUnitOfWork.read(uow).snapshotTransactions.values().stream()
                .filter(copy -> copy.snapshotId().equals(snapshotId))
                .sorted(NEWEST_TRANSACTION_FIRST)
                .collect(Collectors.toList());
    }

    @Override
    public PageResult<SnapshotTransaction> findSnapshotTransactions(UnitOfWork uow, UUID snapshotId, int limit, int skip) {
        List<SnapshotTransaction> copies = findSnapshotTransactions(uow, snapshotId);
        return new PageResult<>(page(copies, limit, skip), copies.size());
    }

    @Override
    public Optional<SnapshotTransaction> findSnapshotTransactionById(UnitOfWork uow, UUID snapshotTransactionId) {
        return Optional.ofNullable(InMemoryUnitOfWork.read(uow).snapshotTransactions.get(snapshotTransactionId));
    }

    @Override
    public SnapshotTransaction saveSnapshotTransaction(UnitOfWork uow, SnapshotTransaction copy) {
        InMemoryUnitOfWork.write(uow).snapshotTransactions.put(copy.id(), copy);
        return copy;
    }

    @Override
    public Optional<SnapshotSchedule> findSchedule(UnitOfWork uow, UUID fiscalBookId) {
        return Optional.ofNullable(InMemoryUnitOfWork.read(uow).schedulesByBook.get(fiscalBookId));
    }

    @Override
    public SnapshotSchedule saveSchedule(UnitOfWork uow, SnapshotSchedule schedule) {
        InMemoryUnitOfWork.write(uow).schedulesByBook.put(schedule.fiscalBookId(), schedule);
        return schedule;
    }

    @Override
    public boolean deleteSchedule(UnitOfWork uow, UUID fiscalBookId) {
        return InMemoryUnitOfWork.write(uow).schedulesByBook.remove(fiscalBookId) != null;
    }

    @Override
    public List<SnapshotSchedule> findDueSchedules(UnitOfWork uow, Instant now) {
        return InMemoryUnitOfWork.read(uow).schedulesByBook.values().stream()
                .filter(SnapshotSchedule::enabled)
                .filter(schedule -> schedule.nextExecutionAt() != null && !schedule.nextExecutionAt().isAfter(now))
                .toList();
    }

    // Later inserts win ties on createdAt.
    private static List<FiscalBookSnapshot> snapshotsOf(InMemoryLedgerState state, UUID fiscalBookId) {
        List<FiscalBookSnapshot> snapshots = state.snapshots.values().stream()
                .filter(snapshot -> snapshot.originalFiscalBookId().equals(fiscalBookId))
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(snapshots);
        snapshots.sort(NEWEST_FIRST);
        return snapshots;
    }

    private static <T> List<T> page(List<T> items, int limit, int skip) {
        int from = Math.min(Math.max(skip, 0), items.size());
        int to = Math.min(from + Math.max(limit, 0), items.size());
        return List.copyOf(items.subList(from, to));
    }
}
