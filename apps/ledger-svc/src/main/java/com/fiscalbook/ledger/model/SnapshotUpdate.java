package com.fiscalbook.ledger.model;

import java.util.List;

/**
 * The mutable fields of a snapshot. A null component leaves the current value untouched.
 */
public record SnapshotUpdate(List<String> tags, Boolean isProtected, Annotation appendAnnotation) {

    public static SnapshotUpdate tags(List<String> tags) {
        return new SnapshotUpdate(FiscalBookSnapshot.normalizeTags(tags), null, null);
    }

    public static SnapshotUpdate protection(boolean isProtected) {
        return new SnapshotUpdate(null, isProtected, null);
    }

    public static SnapshotUpdate annotate(Annotation annotation) {
        return new SnapshotUpdate(null, null, annotation);
    }
}
