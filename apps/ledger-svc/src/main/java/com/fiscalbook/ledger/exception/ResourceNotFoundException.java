package com.fiscalbook.ledger.exception;

import java.util.UUID;

public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final UUID id;

    public ResourceNotFoundException(String resource, UUID id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public static ResourceNotFoundException fiscalBook(UUID id) {
        return new ResourceNotFoundException("Fiscal book", id);
    }

    public static ResourceNotFoundException snapshot(UUID id) {
        return new ResourceNotFoundException("Snapshot", id);
    }

    public static ResourceNotFoundException snapshotTransaction(UUID id) {
        return new ResourceNotFoundException("Snapshot transaction", id);
    }

    public static ResourceNotFoundException schedule(UUID fiscalBookId) {
        return new ResourceNotFoundException("Snapshot schedule for fiscal book", fiscalBookId);
    }

    public String getResource() {
        return resource;
    }

    public UUID getId() {
        return id;
    }
}
