package com.fiscalbook.ledger.controller.dto;

import com.fiscalbook.ledger.model.ScheduleFrequency;
import com.fiscalbook.ledger.snapshot.ScheduleSettings;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ScheduleUpdateRequestDto(
        Boolean enabled,
        @NotNull(message = "frequency is required") ScheduleFrequency frequency,
        @Min(0) @Max(6) Integer dayOfWeek,
        @Min(1) @Max(31) Integer dayOfMonth,
        @Min(1) Integer retentionCount,
        List<String> autoTags
) {
    public ScheduleSettings toSettings() {
        return new ScheduleSettings(enabled, frequency, dayOfWeek, dayOfMonth, retentionCount, autoTags);
    }
}
