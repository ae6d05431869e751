package com.fiscalbook.ledger.controller.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;

public record TagsUpdateRequestDto(@NotNull(message = "tags must be an array") List<String> tags) {
}
