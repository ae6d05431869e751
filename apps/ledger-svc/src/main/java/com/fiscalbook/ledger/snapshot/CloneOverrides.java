package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.model.FiscalData;
import java.util.UUID;

/**
 * Optional replacements for the recorded book fields when cloning. Blank or null values keep the recorded ones.
 */
public record CloneOverrides(
        String bookName,
        String bookType,
        String bookPeriod,
        String reference,
        FiscalData fiscalData,
        UUID companyId,
        String notes
) {
    public static CloneOverrides none() {
        return new CloneOverrides(null, null, null, null, null, null, null);
    }
}
