package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.config.FiscalbookProperties;
import com.fiscalbook.ledger.exception.InvalidRequestException;
import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.model.Annotation;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.SnapshotUpdate;
import com.fiscalbook.ledger.repository.SnapshotStore;
import com.fiscalbook.ledger.repository.SnapshotStore.PageResult;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Reads and curates existing snapshots: listing, deletion, tags, protection and annotations.
 */
@Service
public class SnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final SnapshotStore snapshotStore;
    private final FiscalbookProperties.Snapshots settings;
    private final Clock clock;

    @Autowired
    public SnapshotService(UnitOfWorkRunner unitOfWorkRunner, SnapshotStore snapshotStore, FiscalbookProperties properties) {
        this(unitOfWorkRunner, snapshotStore, properties, Clock.systemUTC());
    }

    SnapshotService(UnitOfWorkRunner unitOfWorkRunner, SnapshotStore snapshotStore, FiscalbookProperties properties, Clock clock) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.snapshotStore = snapshotStore;
        this.settings = properties.snapshots();
        this.clock = clock;
    }

    public PageResult<FiscalBookSnapshot> listSnapshots(UUID fiscalBookId, List<String> tags, Integer limit, Integer skip) {
        int pageSize = pageSize(limit);
        int offset = offset(skip);
        return unitOfWorkRunner.readOnly(uow ->
                snapshotStore.findSnapshotsByFiscalBook(uow, fiscalBookId, FiscalBookSnapshot.normalizeTags(tags), pageSize, offset));
    }

    public FiscalBookSnapshot getSnapshot(UUID snapshotId) {
        return unitOfWorkRunner.readOnly(uow -> snapshotStore.findSnapshotById(uow, snapshotId))
                .orElseThrow(() -> ResourceNotFoundException.snapshot(snapshotId));
    }

    public PageResult<SnapshotTransaction> listSnapshotTransactions(UUID snapshotId, Integer limit, Integer skip) {
        int pageSize = pageSize(limit);
        int offset = offset(skip);
        return unitOfWorkRunner.readOnly(uow -> {
            snapshotStore.findSnapshotById(uow, snapshotId)
                    .orElseThrow(() -> ResourceNotFoundException.snapshot(snapshotId));
            return snapshotStore.findSnapshotTransactions(uow, snapshotId, pageSize, offset);
        });
    }

    /**
     * @throws com.fiscalbook.ledger.exception.ProtectedResourceException when the snapshot is protected
     */
    public FiscalBookSnapshot deleteSnapshot(UUID snapshotId) {
        FiscalBookSnapshot deleted = unitOfWorkRunner.inTransaction(uow -> snapshotStore.deleteSnapshot(uow, snapshotId))
                .orElseThrow(() -> ResourceNotFoundException.snapshot(snapshotId));
        log.info("Snapshot {} of fiscal book {} deleted", snapshotId, deleted.originalFiscalBookId());
        return deleted;
    }

    /**
     * Removes every snapshot of the book, their transaction copies and the book's schedule in one unit of work.
     * Nothing is removed when any of the snapshots is protected.
     *
     * @return number of snapshots deleted
     */
    public int deleteAllForBook(UUID fiscalBookId) {
        int deleted = unitOfWorkRunner.inTransaction(uow -> {
            int count = snapshotStore.deleteSnapshotsByFiscalBook(uow, fiscalBookId);
            snapshotStore.deleteSchedule(uow, fiscalBookId);
            return count;
        });
        log.info("Deleted {} snapshot(s) and the schedule of fiscal book {}", deleted, fiscalBookId);
        return deleted;
    }

    public FiscalBookSnapshot updateTags(UUID snapshotId, List<String> tags) {
        if (tags == null) {
            throw new InvalidRequestException("tags must be an array");
        }
        return update(snapshotId, SnapshotUpdate.tags(tags));
    }

    public FiscalBookSnapshot setProtection(UUID snapshotId, Boolean isProtected) {
        if (isProtected == null) {
            throw new InvalidRequestException("isProtected must be a boolean");
        }
        return update(snapshotId, SnapshotUpdate.protection(isProtected));
    }

    public FiscalBookSnapshot addAnnotation(UUID snapshotId, String content, String createdBy) {
        return update(snapshotId, SnapshotUpdate.annotate(annotation(content, createdBy)));
    }

    public SnapshotTransaction addTransactionAnnotation(UUID snapshotId, UUID snapshotTransactionId, String content, String createdBy) {
        Annotation annotation = annotation(content, createdBy);
        return unitOfWorkRunner.inTransaction(uow -> {
            SnapshotTransaction copy = snapshotStore.findSnapshotTransactionById(uow, snapshotTransactionId)
                    .filter(found -> found.snapshotId().equals(snapshotId))
                    .orElseThrow(() -> ResourceNotFoundException.snapshotTransaction(snapshotTransactionId));
            return snapshotStore.saveSnapshotTransaction(uow, copy.withAnnotation(annotation));
        });
    }

    private FiscalBookSnapshot update(UUID snapshotId, SnapshotUpdate update) {
        return unitOfWorkRunner.inTransaction(uow -> snapshotStore.updateSnapshot(uow, snapshotId, update))
                .orElseThrow(() -> ResourceNotFoundException.snapshot(snapshotId));
    }

    private Annotation annotation(String content, String createdBy) {
        if (content == null || content.isBlank()) {
            throw new InvalidRequestException("Annotation content is required");
        }
        return new Annotation(content.trim(), createdBy, clock.instant());
    }

    private int pageSize(Integer limit) {
        if (limit == null) {
            return settings.defaultPageSize();
        }
        if (limit < 1) {
            throw new InvalidRequestException("limit must be positive");
        }
        return Math.min(limit, settings.maxPageSize());
    }

    private static int offset(Integer skip) {
        if (skip == null) {
            return 0;
        }
        if (skip < 0) {
            throw new InvalidRequestException("skip must not be negative");
        }
        return skip;
    }
}
