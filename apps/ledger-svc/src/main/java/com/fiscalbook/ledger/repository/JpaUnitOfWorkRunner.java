package com.fiscalbook.ledger.repository;

import com.fiscalbook.ledger.exception.StorageException;
import java.util.function.Function;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@Profile("!memory")
public class JpaUnitOfWorkRunner implements UnitOfWorkRunner {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public JpaUnitOfWorkRunner(PlatformTransactionManager transactionManager) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
    }

    @Override
    public <T> T inTransaction(Function<UnitOfWork, T> work) {
        return run(writeTemplate, work, false);
    }

    @Override
    public <T> T readOnly(Function<UnitOfWork, T> work) {
        return run(readTemplate, work, true);
    }

    private <T> T run(TransactionTemplate template, Function<UnitOfWork, T> work, boolean readOnly) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Units of work do not nest");
        }
        try {
            return template.execute(status -> {
                JpaUnitOfWork uow = new JpaUnitOfWork(readOnly);
                try {
                    return work.apply(uow);
                } finally {
                    uow.close();
                }
            });
        } catch (TransactionException e) {
            throw new StorageException(e.getMessage(), e);
        }
    }
}
