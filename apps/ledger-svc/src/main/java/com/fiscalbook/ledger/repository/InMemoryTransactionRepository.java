package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.model.Transaction;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

@Repository
@Profile("memory")
public class InMemoryTransactionRepository implements TransactionRepository {

    @Override
    public List<Transaction> findByFiscalBookId(UnitOfWork uow, UUID fiscalBookId) {
        return InMemoryUnitOfWork.read(uow).transactions.values().stream()
                .filter(tx -> tx.fiscalBookId().equals(fiscalBookId))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Transaction save(UnitOfWork uow, Transaction transaction) {
        InMemoryUnitOfWork.write(uow).transactions.put(transaction.id(), transaction);
        return transaction;
    }

    @Override
    public void saveAll(UnitOfWork uow, List<Transaction> transactions) {
        var storage = InMemoryUnitOfWork.write(uow).transactions;
        transactions.forEach(tx -> storage.put(tx.id(), tx));
    }

    @Override
    public boolean deleteById(UnitOfWork uow, UUID transactionId) {
        return InMemoryUnitOfWork.write(uow).transactions.remove(transactionId) != null;
    }

    @Override
    public int deleteByFiscalBookId(UnitOfWork uow, UUID fiscalBookId) {
        var storage = InMemoryUnitOfWork.write(uow).transactions;
        int before = storage.size();
        storage.entrySet().removeIf(entry -> entry.getValue().fiscalBookId().equals(fiscalBookId));
        return before - storage.size();
    }
}
