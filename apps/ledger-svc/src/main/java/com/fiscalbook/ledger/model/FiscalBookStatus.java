package com.fiscalbook.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FiscalBookStatus {
    OPEN("open"),
    CLOSED("closed"),
    UNDER_REVIEW("under-review"),
    ARCHIVED("archived");

    private final String value;

    FiscalBookStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FiscalBookStatus fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must be provided");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (FiscalBookStatus status : values()) {
            if (status.value.equals(normalized) || status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown fiscal book status: " + raw);
    }
}
