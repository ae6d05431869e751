package com.fiscalbook.ledger.model;

import java.time.Instant;

public record FiscalData(
        String taxAuthority,
        Integer fiscalYear,
        String fiscalPeriod,
        String taxRegime,
        Instant submissionDate,
        Instant dueDate
) {
}
