package com.fiscalbook.ledger.exception;

/**
 * Underlying storage failure. The message of the cause is passed through to callers.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
