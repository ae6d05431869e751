package com.fiscalbook.ledger.snapshot;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiscalbook.ledger.exception.InvalidRequestException;
import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.model.Annotation;
import com.fiscalbook.ledger.model.CreationSource;
import com.fiscalbook.ledger.model.FiscalBookData;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotStatistics;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.model.TransactionData;
import com.fiscalbook.ledger.repository.SnapshotStore;
import com.fiscalbook.ledger.repository.UnitOfWorkRunner;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Service;

/**
 * Renders a snapshot and its transaction copies as a downloadable JSON or CSV document.
 */
@Service
public class SnapshotExporter {

    static final String CSV_HEADER = "Date,Name,Description,Value,Type,Status,Category,Payment Method,Company";

    private final UnitOfWorkRunner unitOfWorkRunner;
    private final SnapshotStore snapshotStore;
    private final ObjectMapper objectMapper;

    public SnapshotExporter(UnitOfWorkRunner unitOfWorkRunner, SnapshotStore snapshotStore, ObjectMapper objectMapper) {
        this.unitOfWorkRunner = unitOfWorkRunner;
        this.snapshotStore = snapshotStore;
        this.objectMapper = objectMapper;
    }

    public ExportResult export(UUID snapshotId, String format) {
        String requested = format == null || format.isBlank() ? "json" : format.trim().toLowerCase(Locale.ROOT);
        if (!requested.equals("json") && !requested.equals("csv")) {
            throw new InvalidRequestException("Unsupported export format: " + requested);
        }

        ExportDocument document = unitOfWorkRunner.readOnly(uow -> {
            FiscalBookSnapshot snapshot = snapshotStore.findSnapshotById(uow, snapshotId)
                    .orElseThrow(() -> ResourceNotFoundException.snapshot(snapshotId));
            List<SnapshotTransaction> copies = snapshotStore.findSnapshotTransactions(uow, snapshotId);
            return ExportDocument.of(snapshot, copies);
        });

        String fileName = "snapshot-" + document.snapshot().name() + "-"
                + LocalDate.ofInstant(document.snapshot().createdAt(), ZoneOffset.UTC) + "." + requested;
        if (requested.equals("csv")) {
            return new ExportResult("csv", "text/csv", fileName, toCsv(document.transactions()));
        }
        return new ExportResult("json", "application/json", fileName, toJson(document));
    }

    private String toJson(ExportDocument document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render snapshot export", e);
        }
    }

    static String toCsv(List<ExportedTransaction> transactions) {
        List<String> lines = new ArrayList<>();
        lines.add(CSV_HEADER);
        for (ExportedTransaction transaction : transactions) {
            TransactionData data = transaction.transactionData();
            String date = data.transactionDate() == null
                    ? ""
                    : LocalDate.ofInstant(data.transactionDate(), ZoneOffset.UTC).toString();
            lines.add(Stream.of(
                            date,
                            data.transactionName(),
                            data.transactionDescription(),
                            data.transactionValue(),
                            data.transactionType(),
                            data.transactionStatus(),
                            data.transactionCategory(),
                            data.paymentMethod(),
                            data.companyName())
                    .map(SnapshotExporter::quote)
                    .collect(Collectors.joining(",")));
        }
        return String.join("\n", lines);
    }

    private static String quote(String cell) {
        String value = cell == null ? "" : cell;
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    public record ExportDocument(ExportedSnapshot snapshot, List<ExportedTransaction> transactions) {

        static ExportDocument of(FiscalBookSnapshot snapshot, List<SnapshotTransaction> copies) {
            return new ExportDocument(
                    new ExportedSnapshot(
                            snapshot.id(),
                            snapshot.snapshotName(),
                            snapshot.snapshotDescription(),
                            snapshot.createdAt(),
                            snapshot.creationSource(),
                            snapshot.tags(),
                            snapshot.fiscalBookData(),
                            snapshot.statistics(),
                            snapshot.annotations()),
                    copies.stream()
                            .filter(copy -> copy.transactionData() != null)
                            .map(copy -> new ExportedTransaction(copy.transactionData(), copy.annotations()))
                            .toList());
        }
    }

    public record ExportedSnapshot(
            UUID id,
            String name,
            String description,
            Instant createdAt,
            CreationSource creationSource,
            List<String> tags,
            FiscalBookData fiscalBookData,
            SnapshotStatistics statistics,
            List<Annotation> annotations
    ) {
    }

    public record ExportedTransaction(@JsonUnwrapped TransactionData transactionData, List<Annotation> annotations) {
    }
}
