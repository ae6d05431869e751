package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.entity.SnapshotTransactionEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaSnapshotTransactionRepository extends JpaRepository<SnapshotTransactionEntity, UUID> {

    List<SnapshotTransactionEntity> findBySnapshotId(UUID snapshotId);

    List<SnapshotTransactionEntity> findBySnapshotId(UUID snapshotId, Sort sort);

    Page<SnapshotTransactionEntity> findBySnapshotId(UUID snapshotId, Pageable pageable);
}
