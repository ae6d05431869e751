package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.model.ScheduleFrequency;
import java.util.List;

/**
 * Requested schedule configuration. Null {@code enabled}, {@code retentionCount} and {@code autoTags}
 * take their defaults; {@code dayOfWeek} is required for weekly schedules.
 */
public record ScheduleSettings(
        Boolean enabled,
        ScheduleFrequency frequency,
        Integer dayOfWeek,
        Integer dayOfMonth,
        Integer retentionCount,
        List<String> autoTags
) {
}
