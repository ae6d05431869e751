package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.model.FiscalBook;
import java.util.Optional;
import java.util.UUID;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

@Repository
@Profile("memory")
public class InMemoryFiscalBookRepository implements FiscalBookRepository {

    @Override
    public Optional<FiscalBook> findById(UnitOfWork uow, UUID fiscalBookId) {
        return Optional.ofNullable(InMemoryUnitOfWork.read(uow).books.get(fiscalBookId));
    }

    @Override
    public FiscalBook save(UnitOfWork uow, FiscalBook fiscalBook) {
        InMemoryUnitOfWork.write(uow).books.put(fiscalBook.id(), fiscalBook);
        return fiscalBook;
    }
}
