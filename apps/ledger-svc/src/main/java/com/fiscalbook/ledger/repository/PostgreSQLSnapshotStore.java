package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.entity.AnnotationEmbeddable;
import com.fiscalbook.ledger.entity.SnapshotEntity;
import com.fiscalbook.ledger.entity.SnapshotScheduleEntity;
import com.fiscalbook.ledger.entity.SnapshotTransactionEntity;
import com.fiscalbook.ledger.exception.ProtectedResourceException;
import com.fiscalbook.ledger.exception.StorageException;
import com.fiscalbook.ledger.model.Annotation;
import com.fiscalbook.ledger.model.CreationSource;
import com.fiscalbook.ledger.model.FiscalBookData;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.ScheduleFrequency;
import com.fiscalbook.ledger.model.SnapshotSchedule;
import com.fiscalbook.ledger.model.SnapshotStatistics;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.SnapshotUpdate;
import com.fiscalbook.ledger.model.TransactionData;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

@Repository
@Profile("!memory")
public class PostgreSQLSnapshotStore implements SnapshotStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");
    private static final Sort NEWEST_TRANSACTION_FIRST = Sort.by(Sort.Order.desc("transactionDate").nullsLast());

    private final JpaSnapshotRepository jpaSnapshotRepository;
    private final JpaSnapshotTransactionRepository jpaSnapshotTransactionRepository;
    private final JpaSnapshotScheduleRepository jpaSnapshotScheduleRepository;
    private final JsonColumns jsonColumns;

    public PostgreSQLSnapshotStore(JpaSnapshotRepository jpaSnapshotRepository,
                                   JpaSnapshotTransactionRepository jpaSnapshotTransactionRepository,
                                   JpaSnapshotScheduleRepository jpaSnapshotScheduleRepository,
                                   JsonColumns jsonColumns) {
        this.jpaSnapshotRepository = jpaSnapshotRepository;
        this.jpaSnapshotTransactionRepository = jpaSnapshotTransactionRepository;
        this.jpaSnapshotScheduleRepository = jpaSnapshotScheduleRepository;
        this.jsonColumns = jsonColumns;
    }

    @Override
    public FiscalBookSnapshot saveSnapshot(UnitOfWork uow, FiscalBookSnapshot snapshot) {
        uow.requireWritable();
        return storage(() -> toModel(jpaSnapshotRepository.save(toEntity(snapshot))));
    }

    @Override
    public void saveSnapshotTransactions(UnitOfWork uow, List<SnapshotTransaction> copies) {
        uow.requireWritable();
        if (copies.isEmpty()) {
            return;
        }
        storage(() -> jpaSnapshotTransactionRepository.saveAll(copies.stream().map(this::toEntity).toList()));
    }

    @Override
    public Optional<FiscalBookSnapshot> findSnapshotById(UnitOfWork uow, UUID snapshotId) {
        uow.requireActive();
        return storage(() -> jpaSnapshotRepository.findById(snapshotId).map(this::toModel));
    }

    @Override
    public PageResult<FiscalBookSnapshot> findSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId, List<String> tags, int limit, int skip) {
        uow.requireActive();
        List<String> required = FiscalBookSnapshot.normalizeTags(tags);
        OffsetPageRequest pageable = new OffsetPageRequest(skip, limit, NEWEST_FIRST);
        return storage(() -> {
            Page<SnapshotEntity> page = required.isEmpty()
                    ? jpaSnapshotRepository.findByOriginalFiscalBookId(fiscalBookId, pageable)
                    : jpaSnapshotRepository.findByBookHavingAllTags(fiscalBookId, required, required.size(), pageable);
            return new PageResult<>(page.getContent().stream().map(this::toModel).toList(), page.getTotalElements());
        });
    }

    @Override
    public List<FiscalBookSnapshot> findAllSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId) {
        uow.requireActive();
        return storage(() -> jpaSnapshotRepository.findByOriginalFiscalBookIdOrderByCreatedAtDesc(fiscalBookId).stream()
                .map(this::toModel)
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<FiscalBookSnapshot> updateSnapshot(UnitOfWork uow, UUID snapshotId, SnapshotUpdate update) {
        uow.requireWritable();
        return storage(() -> jpaSnapshotRepository.findById(snapshotId).map(entity -> {
            FiscalBookSnapshot updated = toModel(entity).apply(update);
            entity.setTags(new ArrayList<>(updated.tags()));
            entity.setProtectedSnapshot(updated.isProtected());
            entity.setAnnotations(toEmbeddables(updated.annotations()));
            jpaSnapshotRepository.save(entity);
            return updated;
        }));
    }

    @Override
    public Optional<FiscalBookSnapshot> deleteSnapshot(UnitOfWork uow, UUID snapshotId) {
        uow.requireWritable();
        return storage(() -> {
            Optional<SnapshotEntity> existing = jpaSnapshotRepository.findById(snapshotId);
            if (existing.isEmpty()) {
                return Optional.<FiscalBookSnapshot>empty();
            }
            SnapshotEntity entity = existing.get();
            if (entity.isProtectedSnapshot()) {
                throw new ProtectedResourceException(snapshotId);
            }
            FiscalBookSnapshot deleted = toModel(entity);
            jpaSnapshotTransactionRepository.deleteAll(jpaSnapshotTransactionRepository.findBySnapshotId(snapshotId));
            jpaSnapshotRepository.delete(entity);
            return Optional.of(deleted);
        });
    }

    @Override
    public int deleteSnapshotsByFiscalBook(UnitOfWork uow, UUID fiscalBookId) {
        uow.requireWritable();
        return storage(() -> {
            jpaSnapshotRepository.findFirstByOriginalFiscalBookIdAndProtectedSnapshotTrue(fiscalBookId)
                    .ifPresent(entity -> {
                        throw new ProtectedResourceException(entity.getId());
                    });
            List<SnapshotEntity> snapshots = jpaSnapshotRepository.findByOriginalFiscalBookIdOrderByCreatedAtDesc(fiscalBookId);
            for (SnapshotEntity snapshot : snapshots) {
                jpaSnapshotTransactionRepository.deleteAll(jpaSnapshotTransactionRepository.findBySnapshotId(snapshot.getId()));
            }
            jpaSnapshotRepository.deleteAll(snapshots);
            return snapshots.size();
        });
    }

    @Override
    public List<UUID> findSnapshotsToCleanup(UnitOfWork uow, UUID fiscalBookId, int retentionCount) {
        uow.requireActive();
        return storage(() -> jpaSnapshotRepository
                .findUnprotectedIdsNewestFirst(fiscalBookId, CreationSource.SCHEDULED.value())
                .stream()
                .skip(Math.max(retentionCount, 0))
                .toList());
    }

    @Override
    public List<SnapshotTransaction> findSnapshotTransactions(UnitOfWork uow, UUID snapshotId) {
        uow.requireActive();
        return storage(() -> jpaSnapshotTransactionRepository.findBySnapshotId(snapshotId, NEWEST_TRANSACTION_FIRST).stream()
                .map(this::toModel)
                .collect(Collectors.toList()));
    }

    @Override
    public PageResult<SnapshotTransaction> findSnapshotTransactions(UnitOfWork uow, UUID snapshotId, int limit, int skip) {
        uow.requireActive();
        OffsetPageRequest pageable = new OffsetPageRequest(skip, limit, NEWEST_TRANSACTION_FIRST);
        return storage(() -> {
            Page<SnapshotTransactionEntity> page = jpaSnapshotTransactionRepository.findBySnapshotId(snapshotId, pageable);
            return new PageResult<>(page.getContent().stream().map(this::toModel).toList(), page.getTotalElements());
        });
    }

    @Override
    public Optional<SnapshotTransaction> findSnapshotTransactionById(UnitOfWork uow, UUID snapshotTransactionId) {
        uow.requireActive();
        return storage(() -> jpaSnapshotTransactionRepository.findById(snapshotTransactionId).map(this::toModel));
    }

    @Override
    public SnapshotTransaction saveSnapshotTransaction(UnitOfWork uow, SnapshotTransaction copy) {
        uow.requireWritable();
        return storage(() -> toModel(jpaSnapshotTransactionRepository.save(toEntity(copy))));
    }

    @Override
    public Optional<SnapshotSchedule> findSchedule(UnitOfWork uow, UUID fiscalBookId) {
        uow.requireActive();
        return storage(() -> jpaSnapshotScheduleRepository.findByFiscalBookId(fiscalBookId).map(this::toModel));
    }

    @Override
    public SnapshotSchedule saveSchedule(UnitOfWork uow, SnapshotSchedule schedule) {
        uow.requireWritable();
        return storage(() -> {
            SnapshotScheduleEntity entity = jpaSnapshotScheduleRepository.findByFiscalBookId(schedule.fiscalBookId())
                    .orElseGet(SnapshotScheduleEntity::new);
            if (entity.getId() == null) {
                entity.setId(schedule.id());
                entity.setCreatedAt(schedule.createdAt());
            }
            entity.setFiscalBookId(schedule.fiscalBookId());
            entity.setEnabled(schedule.enabled());
            entity.setFrequency(schedule.frequency().value());
            entity.setDayOfWeek(schedule.dayOfWeek());
            entity.setDayOfMonth(schedule.dayOfMonth());
            entity.setRetentionCount(schedule.retentionCount());
            entity.setAutoTags(new ArrayList<>(schedule.autoTags()));
            entity.setLastExecutedAt(schedule.lastExecutedAt());
            entity.setNextExecutionAt(schedule.nextExecutionAt());
            entity.setUpdatedAt(schedule.updatedAt());
            return toModel(jpaSnapshotScheduleRepository.save(entity));
        });
    }

    @Override
    public boolean deleteSchedule(UnitOfWork uow, UUID fiscalBookId) {
        uow.requireWritable();
        return storage(() -> jpaSnapshotScheduleRepository.findByFiscalBookId(fiscalBookId)
                .map(entity -> {
                    jpaSnapshotScheduleRepository.delete(entity);
                    return true;
                })
                .orElse(false));
    }

    @Override
    public List<SnapshotSchedule> findDueSchedules(UnitOfWork uow, Instant now) {
        uow.requireActive();
        return storage(() -> jpaSnapshotScheduleRepository.findDue(now).stream().map(this::toModel).toList());
    }

    private static <T> T storage(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    private FiscalBookSnapshot toModel(SnapshotEntity entity) {
        return new FiscalBookSnapshot(
                entity.getId(),
                entity.getOriginalFiscalBookId(),
                entity.getSnapshotName(),
                entity.getSnapshotDescription(),
                CreationSource.fromValue(entity.getCreationSource()),
                List.copyOf(entity.getTags()),
                entity.isProtectedSnapshot(),
                toAnnotations(entity.getAnnotations()),
                jsonColumns.read(entity.getFiscalBookData(), FiscalBookData.class),
                new SnapshotStatistics(
                        entity.getTransactionCount(),
                        entity.getTotalIncome(),
                        entity.getTotalExpenses(),
                        entity.getNetAmount()
                ),
                entity.getCreatedAt()
        );
    }

    private SnapshotEntity toEntity(FiscalBookSnapshot snapshot) {
        SnapshotEntity entity = new SnapshotEntity();
        entity.setId(snapshot.id());
        entity.setOriginalFiscalBookId(snapshot.originalFiscalBookId());
        entity.setSnapshotName(snapshot.snapshotName());
        entity.setSnapshotDescription(snapshot.snapshotDescription());
        entity.setCreationSource(snapshot.creationSource().value());
        entity.setProtectedSnapshot(snapshot.isProtected());
        entity.setTags(new ArrayList<>(snapshot.tags()));
        entity.setAnnotations(toEmbeddables(snapshot.annotations()));
        entity.setFiscalBookData(jsonColumns.write(snapshot.fiscalBookData()));
        entity.setTransactionCount(snapshot.statistics().transactionCount());
        entity.setTotalIncome(snapshot.statistics().totalIncome());
        entity.setTotalExpenses(snapshot.statistics().totalExpenses());
        entity.setNetAmount(snapshot.statistics().netAmount());
        entity.setCreatedAt(snapshot.createdAt());
        return entity;
    }

    private SnapshotTransaction toModel(SnapshotTransactionEntity entity) {
        return new SnapshotTransaction(
                entity.getId(),
                entity.getSnapshotId(),
                entity.getOriginalTransactionId(),
                jsonColumns.read(entity.getTransactionData(), TransactionData.class),
                toAnnotations(entity.getAnnotations()),
                entity.getCopiedAt()
        );
    }

    private SnapshotTransactionEntity toEntity(SnapshotTransaction copy) {
        SnapshotTransactionEntity entity = new SnapshotTransactionEntity();
        entity.setId(copy.id());
        entity.setSnapshotId(copy.snapshotId());
        entity.setOriginalTransactionId(copy.originalTransactionId());
        entity.setTransactionDate(copy.transactionData() == null ? null : copy.transactionData().transactionDate());
        entity.setTransactionData(jsonColumns.write(copy.transactionData()));
        entity.setAnnotations(toEmbeddables(copy.annotations()));
        entity.setCopiedAt(copy.copiedAt());
        return entity;
    }

    private SnapshotSchedule toModel(SnapshotScheduleEntity entity) {
        return new SnapshotSchedule(
                entity.getId(),
                entity.getFiscalBookId(),
                entity.isEnabled(),
                ScheduleFrequency.fromValue(entity.getFrequency()),
                entity.getDayOfWeek(),
                entity.getDayOfMonth(),
                entity.getRetentionCount(),
                List.copyOf(entity.getAutoTags()),
                entity.getLastExecutedAt(),
                entity.getNextExecutionAt(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }

    private static List<Annotation> toAnnotations(List<AnnotationEmbeddable> embeddables) {
        return embeddables.stream()
                .map(a -> new Annotation(a.getContent(), a.getCreatedBy(), a.getCreatedAt()))
                .toList();
    }

    private static List<AnnotationEmbeddable> toEmbeddables(List<Annotation> annotations) {
        return annotations.stream()
                .map(a -> new AnnotationEmbeddable(a.content(), a.createdBy(), a.createdAt()))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
