package com.fiscalbook.ledger.repository;

import java.util.function.Function;

/**
 * Runs work inside a storage transaction: every write made through the handle commits together when
 * {@code work} returns, or none does when it throws. Units of work do not nest.
 */
public interface UnitOfWorkRunner {

    <T> T inTransaction(Function<UnitOfWork, T> work);

    <T> T readOnly(Function<UnitOfWork, T> work);
}
