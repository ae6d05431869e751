package com.fiscalbook.ledger.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnnotationRequestDto(
        @NotBlank(message = "content is required") @Size(max = 5000) String content,
        @Size(max = 255) String createdBy
) {
}
