package com.fiscalbook.ledger.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a snapshot came to exist. Only {@link #SCHEDULED} snapshots are subject to retention.
 */
public enum CreationSource {
    MANUAL("manual"),
    SCHEDULED("scheduled"),
    BEFORE_STATUS_CHANGE("before-status-change");

    private final String value;

    CreationSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CreationSource fromValue(String raw) {
        for (CreationSource source : values()) {
            if (source.value.equalsIgnoreCase(raw) || source.name().equalsIgnoreCase(raw)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown creation source: " + raw);
    }
}
