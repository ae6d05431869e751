package com.fiscalbook.ledger.repository;

import java.util.function.Function;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Each transaction works on a private copy of the committed state, swapped in only when the work returns.
 * Writers are serialised; readers see the last committed state.
 */
@Component
@Profile("memory")
public class InMemoryUnitOfWorkRunner implements UnitOfWorkRunner {

    private final ThreadLocal<InMemoryUnitOfWork> current = new ThreadLocal<>();
    private volatile InMemoryLedgerState committed = new InMemoryLedgerState();

    @Override
    public synchronized <T> T inTransaction(Function<UnitOfWork, T> work) {
        InMemoryUnitOfWork uow = begin(committed.copy(), false);
        try {
            T result = work.apply(uow);
            committed = uow.state();
            return result;
        } finally {
            end(uow);
        }
    }

    @Override
    public <T> T readOnly(Function<UnitOfWork, T> work) {
        InMemoryUnitOfWork uow = begin(committed, true);
        try {
            return work.apply(uow);
        } finally {
            end(uow);
        }
    }

    private InMemoryUnitOfWork begin(InMemoryLedgerState state, boolean readOnly) {
        if (current.get() != null) {
            throw new IllegalStateException("Units of work do not nest");
        }
        InMemoryUnitOfWork uow = new InMemoryUnitOfWork(state, readOnly);
        current.set(uow);
        return uow;
    }

    private void end(InMemoryUnitOfWork uow) {
        uow.close();
        current.remove();
    }
}
