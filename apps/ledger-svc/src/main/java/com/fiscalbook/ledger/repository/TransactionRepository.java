package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.model.Transaction;
import java.util.List;
import java.util.UUID;

public interface TransactionRepository {

    List<Transaction> findByFiscalBookId(UnitOfWork uow, UUID fiscalBookId);

    Transaction save(UnitOfWork uow, Transaction transaction);

    void saveAll(UnitOfWork uow, List<Transaction> transactions);

    boolean deleteById(UnitOfWork uow, UUID transactionId);

    int deleteByFiscalBookId(UnitOfWork uow, UUID fiscalBookId);
}
