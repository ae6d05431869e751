package com.fiscalbook.ledger.model;

import java.time.Instant;
import java.util.UUID;

public record FiscalBook(
        UUID id,
        String bookName,
        String bookType,
        String bookPeriod,
        String reference,
        FiscalBookStatus status,
        FiscalData fiscalData,
        UUID companyId,
        String notes,
        Instant createdAt,
        Instant updatedAt,
        Instant closedAt
) {
    public FiscalBookData descriptiveData() {
        return new FiscalBookData(
                bookName,
                bookType,
                bookPeriod,
                reference,
                status,
                fiscalData,
                companyId,
                notes,
                createdAt,
                updatedAt,
                closedAt
        );
    }

    /**
     * Overwrites every descriptive field with the recorded copy. Identity and creation time stay with this book.
     */
    public FiscalBook restoredFrom(FiscalBookData data, Instant now) {
        return new FiscalBook(
                id,
                data.bookName(),
                data.bookType(),
                data.bookPeriod(),
                data.reference(),
                data.status(),
                data.fiscalData(),
                data.companyId(),
                data.notes(),
                createdAt,
                now,
                data.closedAt()
        );
    }

    public FiscalBook withStatus(FiscalBookStatus newStatus, Instant now) {
        Instant newClosedAt = newStatus == FiscalBookStatus.CLOSED ? now : closedAt;
        return new FiscalBook(
                id,
                bookName,
                bookType,
                bookPeriod,
                reference,
                newStatus,
                fiscalData,
                companyId,
                notes,
                createdAt,
                now,
                newClosedAt
        );
    }
}
