package com.fiscalbook.ledger.repository;

/**
 * Handle scoping a group of repository calls to one storage transaction. Every repository method takes
 * the handle explicitly; it is only valid inside the {@link UnitOfWorkRunner} call that created it.
 */
public interface UnitOfWork {

    boolean isReadOnly();

    boolean isActive();

    default void requireActive() {
        if (!isActive()) {
            throw new IllegalStateException("Unit of work is no longer active");
        }
    }

    default void requireWritable() {
        requireActive();
        if (isReadOnly()) {
            throw new IllegalStateException("Unit of work is read-only");
        }
    }
}
