package com.fiscalbook.ledger.model;

import java.time.Instant;

public record Annotation(String content, String createdBy, Instant createdAt) {

    public static final String DEFAULT_AUTHOR = "system";

    public Annotation {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Annotation content is required");
        }
        if (createdBy == null || createdBy.isBlank()) {
            createdBy = DEFAULT_AUTHOR;
        }
    }
}
