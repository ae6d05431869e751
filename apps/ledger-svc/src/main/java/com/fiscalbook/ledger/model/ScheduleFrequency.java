package com.fiscalbook.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ScheduleFrequency {
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    BEFORE_STATUS_CHANGE("before-status-change");

    private final String value;

    ScheduleFrequency(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isPeriodic() {
        return this != BEFORE_STATUS_CHANGE;
    }

    @JsonCreator
    public static ScheduleFrequency fromValue(String raw) {
        for (ScheduleFrequency frequency : values()) {
            if (frequency.value.equalsIgnoreCase(raw) || frequency.name().equalsIgnoreCase(raw)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown schedule frequency: " + raw);
    }
}
