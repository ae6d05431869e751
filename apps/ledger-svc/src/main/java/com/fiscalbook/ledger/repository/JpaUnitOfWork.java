package com.fiscalbook.ledger.repository;

final class JpaUnitOfWork implements UnitOfWork {

    private final boolean readOnly;
    private volatile boolean active = true;

    JpaUnitOfWork(boolean readOnly) {
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
}
