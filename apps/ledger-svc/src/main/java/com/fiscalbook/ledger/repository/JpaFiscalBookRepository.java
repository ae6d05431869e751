package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.entity.FiscalBookEntity;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaFiscalBookRepository extends JpaRepository<FiscalBookEntity, UUID> {
}
