package com.fiscalbook.ledger.repository;

final class InMemoryUnitOfWork implements UnitOfWork {

    private final InMemoryLedgerState state;
    private final boolean readOnly;
    private volatile boolean active = true;

    InMemoryUnitOfWork(InMemoryLedgerState state, boolean readOnly) {
        this.state = state;
        this.readOnly = readOnly;
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    void close() {
        active = false;
    }

    InMemoryLedgerState state() {
        return state;
    }

    static InMemoryLedgerState read(UnitOfWork uow) {
        uow.requireActive();
        return cast(uow).state;
    }

    static InMemoryLedgerState write(UnitOfWork uow) {
        uow.requireWritable();
        return cast(uow).state;
    }

    private static InMemoryUnitOfWork cast(UnitOfWork uow) {
        if (!(uow instanceof InMemoryUnitOfWork inMemory)) {
            throw new IllegalArgumentException("Unit of work was not created by the in-memory runner");
        }
        return inMemory;
    }
}
