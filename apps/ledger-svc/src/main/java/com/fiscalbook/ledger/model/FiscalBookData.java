package com.fiscalbook.ledger.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Descriptive fields of a fiscal book as copied into a snapshot at capture time.
 */
public record FiscalBookData(
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
}
