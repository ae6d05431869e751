package com.fiscalbook.ledger.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SnapshotSchedule(
        UUID id,
        UUID fiscalBookId,
        boolean enabled,
        ScheduleFrequency frequency,
        Integer dayOfWeek,
        Integer dayOfMonth,
        int retentionCount,
        List<String> autoTags,
        Instant lastExecutedAt,
        Instant nextExecutionAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int DEFAULT_RETENTION_COUNT = 12;
    public static final List<String> DEFAULT_AUTO_TAGS = List.of("auto");

    public SnapshotSchedule {
        List<String> normalized = FiscalBookSnapshot.normalizeTags(autoTags);
        autoTags = normalized.isEmpty() ? DEFAULT_AUTO_TAGS : normalized;
    }

    public State state() {
        if (!enabled) {
            return State.DISABLED;
        }
        return switch (frequency) {
            case WEEKLY -> State.ENABLED_WEEKLY;
            case MONTHLY -> State.ENABLED_MONTHLY;
            case BEFORE_STATUS_CHANGE -> State.ENABLED_EVENT;
        };
    }

    public SnapshotSchedule executed(Instant executedAt, Instant nextRun) {
        return new SnapshotSchedule(
                id,
                fiscalBookId,
                enabled,
                frequency,
                dayOfWeek,
                dayOfMonth,
                retentionCount,
                autoTags,
                executedAt,
                nextRun,
                createdAt,
                executedAt
        );
    }

    public SnapshotSchedule disabled(Instant now) {
        return new SnapshotSchedule(
                id,
                fiscalBookId,
                false,
                frequency,
                dayOfWeek,
                dayOfMonth,
                retentionCount,
                autoTags,
                lastExecutedAt,
                null,
                createdAt,
                now
        );
    }

    public enum State {
        DISABLED,
        ENABLED_WEEKLY,
        ENABLED_MONTHLY,
        ENABLED_EVENT
    }
}
