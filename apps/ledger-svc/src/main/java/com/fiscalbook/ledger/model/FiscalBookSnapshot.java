package com.fiscalbook.ledger.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable header of a point-in-time copy of a fiscal book. Only tags, protection and annotations
 * change after creation, and only through {@link SnapshotUpdate}.
 */
public record FiscalBookSnapshot(
        UUID id,
        UUID originalFiscalBookId,
        String snapshotName,
        String snapshotDescription,
        CreationSource creationSource,
        List<String> tags,
        @JsonProperty("isProtected") boolean isProtected,
        List<Annotation> annotations,
        FiscalBookData fiscalBookData,
        SnapshotStatistics statistics,
        Instant createdAt
) {
    public FiscalBookSnapshot {
        tags = normalizeTags(tags);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    public boolean hasAllTags(Collection<String> required) {
        return tags.containsAll(normalizeTags(required));
    }

    public FiscalBookSnapshot apply(SnapshotUpdate update) {
        List<String> newTags = update.tags() != null ? update.tags() : tags;
        boolean newProtected = update.isProtected() != null ? update.isProtected() : isProtected;
        List<Annotation> newAnnotations = annotations;
        if (update.appendAnnotation() != null) {
            newAnnotations = new ArrayList<>(annotations);
            newAnnotations.add(update.appendAnnotation());
        }
        return new FiscalBookSnapshot(
                id,
                originalFiscalBookId,
                snapshotName,
                snapshotDescription,
                creationSource,
                newTags,
                newProtected,
                newAnnotations,
                fiscalBookData,
                statistics,
                createdAt
        );
    }

    /**
     * Trimmed, lower-cased, blank-free and de-duplicated, keeping first-seen order.
     */
    public static List<String> normalizeTags(Collection<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String tag : raw) {
            if (tag == null) {
                continue;
            }
            String value = tag.trim().toLowerCase(Locale.ROOT);
            if (!value.isEmpty()) {
                normalized.add(value);
            }
        }
        return List.copyOf(normalized);
    }
}
