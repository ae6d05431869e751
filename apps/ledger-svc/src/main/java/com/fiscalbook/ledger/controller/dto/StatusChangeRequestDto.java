package com.fiscalbook.ledger.controller.dto;

import com.fiscalbook.ledger.model.FiscalBookStatus;
import jakarta.validation.constraints.NotNull;

public record StatusChangeRequestDto(@NotNull(message = "status is required") FiscalBookStatus status) {
}
