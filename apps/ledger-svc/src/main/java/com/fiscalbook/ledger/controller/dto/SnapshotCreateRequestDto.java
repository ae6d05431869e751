package com.fiscalbook.ledger.controller.dto;

import jakarta.validation.constraints.Size;
import java.util.List;

public record SnapshotCreateRequestDto(
        @Size(max = 255) String name,
        @Size(max = 2000) String description,
        List<String> tags
) {
}
