package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.entity.SnapshotEntity;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaSnapshotRepository extends JpaRepository<SnapshotEntity, UUID> {

    Page<SnapshotEntity> findByOriginalFiscalBookId(UUID originalFiscalBookId, Pageable pageable);

    @Query(value = """
            SELECT s FROM SnapshotEntity s
            WHERE s.originalFiscalBookId = :bookId
              AND (SELECT COUNT(DISTINCT t) FROM SnapshotEntity s2 JOIN s2.tags t
                   WHERE s2.id = s.id AND t IN :tags) = :tagCount
            """,
            countQuery = """
            SELECT COUNT(s) FROM SnapshotEntity s
            WHERE s.originalFiscalBookId = :bookId
              AND (SELECT COUNT(DISTINCT t) FROM SnapshotEntity s2 JOIN s2.tags t
                   WHERE s2.id = s.id AND t IN :tags) = :tagCount
            """)
    Page<SnapshotEntity> findByBookHavingAllTags(@Param("bookId") UUID bookId,
                                                 @Param("tags") Collection<String> tags,
                                                 @Param("tagCount") long tagCount,
                                                 Pageable pageable);

    List<SnapshotEntity> findByOriginalFiscalBookIdOrderByCreatedAtDesc(UUID originalFiscalBookId);

    @Query("""
            SELECT s.id FROM SnapshotEntity s
            WHERE s.originalFiscalBookId = :bookId
              AND s.creationSource = :creationSource
              AND s.protectedSnapshot = false
            ORDER BY s.createdAt DESC
            """)
    List<UUID> findUnprotectedIdsNewestFirst(@Param("bookId") UUID bookId,
                                             @Param("creationSource") String creationSource);

    Optional<SnapshotEntity> findFirstByOriginalFiscalBookIdAndProtectedSnapshotTrue(UUID originalFiscalBookId);
}
