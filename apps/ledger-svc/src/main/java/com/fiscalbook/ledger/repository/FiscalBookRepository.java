package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.model.FiscalBook;
import java.util.Optional;
import java.util.UUID;

public interface FiscalBookRepository {

    Optional<FiscalBook> findById(UnitOfWork uow, UUID fiscalBookId);

    FiscalBook save(UnitOfWork uow, FiscalBook fiscalBook);
}
