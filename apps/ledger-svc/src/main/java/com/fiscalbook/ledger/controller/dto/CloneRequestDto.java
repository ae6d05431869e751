package com.fiscalbook.ledger.controller.dto;

import com.fiscalbook.ledger.model.FiscalData;
import com.fiscalbook.ledger.snapshot.CloneOverrides;
import java.util.UUID;

public record CloneRequestDto(
        String bookName,
        String bookType,
        String bookPeriod,
        String reference,
        FiscalData fiscalData,
        UUID companyId,
        String notes
) {
    public CloneOverrides toOverrides() {
        return new CloneOverrides(bookName, bookType, bookPeriod, reference, fiscalData, companyId, notes);
    }
}
