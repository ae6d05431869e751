package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.entity.TransactionEntity;
import com.fiscalbook.ledger.exception.StorageException;
import com.fiscalbook.ledger.model.Transaction;
import com.fiscalbook.ledger.model.TransactionData;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

@Repository
@Profile("!memory")
public class PostgreSQLTransactionRepository implements TransactionRepository {

    private final JpaTransactionRepository jpaTransactionRepository;
    private final JsonColumns jsonColumns;

    public PostgreSQLTransactionRepository(JpaTransactionRepository jpaTransactionRepository, JsonColumns jsonColumns) {
        this.jpaTransactionRepository = jpaTransactionRepository;
        this.jsonColumns = jsonColumns;
    }

    @Override
    public List<Transaction> findByFiscalBookId(UnitOfWork uow, UUID fiscalBookId) {
        uow.requireActive();
        try {
            return jpaTransactionRepository.findByFiscalBookId(fiscalBookId).stream()
                    .map(this::toModel)
                    .collect(Collectors.toList());
        } catch (DataAccessException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    @Override
    public Transaction save(UnitOfWork uow, Transaction transaction) {
        uow.requireWritable();
        try {
            return toModel(jpaTransactionRepository.save(toEntity(transaction)));
        } catch (DataAccessException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    @Override
    public void saveAll(UnitOfWork uow, List<Transaction> transactions) {
        uow.requireWritable();
        if (transactions.isEmpty()) {
            return;
        }
        try {
            jpaTransactionRepository.saveAll(transactions.stream().map(this::toEntity).toList());
        } catch (DataAccessException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    @Override
    public boolean deleteById(UnitOfWork uow, UUID transactionId) {
        uow.requireWritable();
        try {
            if (!jpaTransactionRepository.existsById(transactionId)) {
                return false;
            }
            jpaTransactionRepository.deleteById(transactionId);
            return true;
        } catch (DataAccessException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    @Override
    public int deleteByFiscalBookId(UnitOfWork uow, UUID fiscalBookId) {
        uow.requireWritable();
        try {
            return jpaTransactionRepository.deleteByFiscalBookId(fiscalBookId);
        } catch (DataAccessException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }

    private Transaction toModel(TransactionEntity entity) {
        return new Transaction(
                entity.getId(),
                entity.getFiscalBookId(),
                jsonColumns.read(entity.getTransactionData(), TransactionData.class)
        );
    }

    private TransactionEntity toEntity(Transaction transaction) {
        return new TransactionEntity(
                transaction.id(),
                transaction.fiscalBookId(),
                transaction.data() == null ? null : transaction.data().transactionDate(),
                jsonColumns.write(transaction.data())
        );
    }
}
