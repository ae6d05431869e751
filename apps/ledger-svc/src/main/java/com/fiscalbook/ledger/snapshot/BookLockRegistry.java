package com.fiscalbook.ledger.snapshot;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Per-book mutual exclusion for capture, rollback and retention cleanup inside this JVM.
 * Locks are reentrant, so a rollback may capture its safety snapshot while holding the book's lock.
 * An entry lives only while some thread holds or waits for it.
 */
@Component
public class BookLockRegistry {

    private final ConcurrentMap<UUID, BookLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(UUID fiscalBookId, Supplier<T> action) {
        BookLock entry = acquireEntry(fiscalBookId);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            releaseEntry(fiscalBookId);
        }
    }

    boolean isLocked(UUID fiscalBookId) {
        BookLock entry = locks.get(fiscalBookId);
        return entry != null && entry.lock.isLocked();
    }

    int trackedBooks() {
        return locks.size();
    }

    // users is only touched inside compute, which runs atomically per key
    private BookLock acquireEntry(UUID fiscalBookId) {
        return locks.compute(fiscalBookId, (id, existing) -> {
            BookLock entry = existing != null ? existing : new BookLock();
            entry.users++;
            return entry;
        });
    }

    private void releaseEntry(UUID fiscalBookId) {
        locks.computeIfPresent(fiscalBookId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class BookLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
