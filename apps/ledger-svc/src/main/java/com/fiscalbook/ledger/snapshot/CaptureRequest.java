package com.fiscalbook.ledger.snapshot;

import com.fiscalbook.ledger.model.CreationSource;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import java.util.List;

/**
 * Caller-supplied fields of a new snapshot. Null name and source fall back to capture defaults.
 */
public record CaptureRequest(
        String name,
        String description,
        List<String> tags,
        CreationSource creationSource
) {
    public CaptureRequest {
        tags = FiscalBookSnapshot.normalizeTags(tags);
    }

    public static CaptureRequest manual(String name, String description, List<String> tags) {
        return new CaptureRequest(name, description, tags, CreationSource.MANUAL);
    }
}
