package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.entity.FiscalBookEntity;
import com.fiscalbook.ledger.exception.StorageException;
import com.fiscalbook.ledger.model.FiscalBook;
import com.fiscalbook.ledger.model.FiscalBookStatus;
import com.fiscalbook.ledger.model.FiscalData;
import java.util.Optional;
import java.util.UUID;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

@Repository
@Profile("!memory")
public class PostgreSQLFiscalBookRepository implements FiscalBookRepository {

    private final JpaFiscalBookRepository jpaFiscalBookRepository;
    private final JsonColumns jsonColumns;

    public PostgreSQLFiscalBookRepository(JpaFiscalBookRepository jpaFiscalBookRepository, JsonColumns jsonColumns) {
        this.jpaFiscalBookRepository = jpaFiscalBookRepository;
        this.jsonColumns = jsonColumns;
    }

    @Override
    public Optional<FiscalBook> findById(UnitOfWork uow, UUID fiscalBookId) {
        uow.requireActive();
        try {
            return jpaFiscalBookRepository.findById(fiscalBookId).map(this::toModel);
        } catch (DataAccessException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    @Override
    public FiscalBook save(UnitOfWork uow, FiscalBook fiscalBook) {
        uow.requireWritable();
        try {
            return toModel(jpaFiscalBookRepository.save(toEntity(fiscalBook)));
        } catch (DataAccessException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    private FiscalBook toModel(FiscalBookEntity entity) {
        return new FiscalBook(
                entity.getId(),
                entity.getBookName(),
                entity.getBookType(),
                entity.getBookPeriod(),
                entity.getReference(),
                FiscalBookStatus.fromValue(entity.getStatus()),
                jsonColumns.read(entity.getFiscalData(), FiscalData.class),
                entity.getCompanyId(),
                entity.getNotes(),
                entity.getCreatedAt(),
                entity.getUpdatedAt(),
                entity.getClosedAt()
        );
    }

    private FiscalBookEntity toEntity(FiscalBook book) {
        FiscalBookEntity entity = new FiscalBookEntity();
        entity.setId(book.id());
        entity.setBookName(book.bookName());
        entity.setBookType(book.bookType());
        entity.setBookPeriod(book.bookPeriod());
        entity.setReference(book.reference());
        entity.setStatus(book.status().value());
        entity.setFiscalData(jsonColumns.write(book.fiscalData()));
        entity.setCompanyId(book.companyId());
        entity.setNotes(book.notes());
        entity.setCreatedAt(book.createdAt());
        entity.setUpdatedAt(book.updatedAt());
        entity.setClosedAt(book.closedAt());
        return entity;
    }
}
