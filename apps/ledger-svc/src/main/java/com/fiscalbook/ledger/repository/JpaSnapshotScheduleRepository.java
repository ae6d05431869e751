package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.entity.SnapshotScheduleEntity;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaSnapshotScheduleRepository extends JpaRepository<SnapshotScheduleEntity, UUID> {

    Optional<SnapshotScheduleEntity> findByFiscalBookId(UUID fiscalBookId);

    @Query("""
            SELECT s FROM SnapshotScheduleEntity s
            WHERE s.enabled = true AND s.nextExecutionAt IS NOT NULL AND s.nextExecutionAt <= :now
            ORDER BY s.nextExecutionAt ASC
            """)
    List<SnapshotScheduleEntity> findDue(@Param("now") Instant now);
}
