package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.entity.TransactionEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaTransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    List<TransactionEntity> findByFiscalBookId(UUID fiscalBookId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM TransactionEntity t WHERE t.fiscalBookId = :fiscalBookId")
    int deleteByFiscalBookId(@Param("fiscalBookId") UUID fiscalBookId);
}
