package com.fiscalbook.ledger.snapshot;

public record ExportResult(String format, String contentType, String fileName, String data) {
}
