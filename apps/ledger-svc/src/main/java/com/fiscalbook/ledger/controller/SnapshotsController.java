package com.fiscalbook.ledger.controller;

import com.fiscalbook.ledger.controller.dto.AnnotationRequestDto;
import com.fiscalbook.ledger.controller.dto.ApiResponseDto;
import com.fiscalbook.ledger.controller.dto.CloneRequestDto;
import com.fiscalbook.ledger.controller.dto.PaginationDto;
import com.fiscalbook.ledger.controller.dto.ProtectionUpdateRequestDto;
import com.fiscalbook.ledger.controller.dto.RollbackRequestDto;
import com.fiscalbook.ledger.controller.dto.TagsUpdateRequestDto;
import com.fiscalbook.ledger.model.FiscalBook;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotTransaction;
import com.fiscalbook.ledger.snapshot.CloneOverrides;
import com.fiscalbook.ledger.snapshot.ExportResult;
import com.fiscalbook.ledger.snapshot.RollbackCoordinator;
import com.fiscalbook.ledger.snapshot.RollbackResult;
import com.fiscalbook.ledger.snapshot.ScheduleEngine;
import com.fiscalbook.ledger.snapshot.ScheduleExecutionResult;
import com.fiscalbook.ledger.snapshot.SnapshotComparator;
import com.fiscalbook.ledger.snapshot.SnapshotComparison;
import com.fiscalbook.ledger.snapshot.SnapshotExporter;
import com.fiscalbook.ledger.snapshot.SnapshotService;
import jakarta.validation.Valid;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/snapshots")
public class SnapshotsController {

    private final SnapshotService snapshotService;
    private final SnapshotComparator snapshotComparator;
    private final SnapshotExporter snapshotExporter;
    private final RollbackCoordinator rollbackCoordinator;
    private final ScheduleEngine scheduleEngine;

    public SnapshotsController(SnapshotService snapshotService,
                               SnapshotComparator snapshotComparator,
                               SnapshotExporter snapshotExporter,
                               RollbackCoordinator rollbackCoordinator,
                               ScheduleEngine scheduleEngine) {
        this.snapshotService = snapshotService;
        this.snapshotComparator = snapshotComparator;
        this.snapshotExporter = snapshotExporter;
        this.rollbackCoordinator = rollbackCoordinator;
        this.scheduleEngine = scheduleEngine;
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponseDto<FiscalBookSnapshot>> getSnapshot(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiResponseDto.ok(snapshotService.getSnapshot(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponseDto<FiscalBookSnapshot>> deleteSnapshot(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiResponseDto.ok("Snapshot deleted successfully", snapshotService.deleteSnapshot(id)));
    }

    @GetMapping("/{id}/transactions")
    public ResponseEntity<ApiResponseDto<List<SnapshotTransaction>>> listTransactions(
            @PathVariable("id") UUID id,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "skip", required = false) Integer skip
    ) {
        var page = snapshotService.listSnapshotTransactions(id, limit, skip);
        return ResponseEntity.ok(ApiResponseDto.page(page.items(),
                PaginationDto.of(page.total(), page.items().size(), limit, skip)));
    }

    @GetMapping("/{id}/compare")
    public ResponseEntity<ApiResponseDto<SnapshotComparison>> compare(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ApiResponseDto.ok(snapshotComparator.compare(id)));
    }

    @PutMapping("/{id}/tags")
    public ResponseEntity<ApiResponseDto<FiscalBookSnapshot>> updateTags(
            @PathVariable("id") UUID id,
            @RequestBody @Valid TagsUpdateRequestDto request
    ) {
        return ResponseEntity.ok(ApiResponseDto.ok("Tags updated successfully", snapshotService.updateTags(id, request.tags())));
    }

    @PutMapping("/{id}/protection")
    public ResponseEntity<ApiResponseDto<FiscalBookSnapshot>> updateProtection(
            @PathVariable("id") UUID id,
            @RequestBody @Valid ProtectionUpdateRequestDto request
    ) {
        FiscalBookSnapshot snapshot = snapshotService.setProtection(id, request.protectedFlag());
        String message = snapshot.isProtected() ? "Snapshot protected" : "Snapshot protection removed";
        return ResponseEntity.ok(ApiResponseDto.ok(message, snapshot));
    }

    @PostMapping("/{id}/annotations")
    public ResponseEntity<ApiResponseDto<FiscalBookSnapshot>> addAnnotation(
            @PathVariable("id") UUID id,
            @RequestBody @Valid AnnotationRequestDto request
    ) {
        FiscalBookSnapshot snapshot = snapshotService.addAnnotation(id, request.content(), request.createdBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponseDto.ok("Annotation added successfully", snapshot));
    }

    @PostMapping("/{id}/transactions/{snapshotTransactionId}/annotations")
    public ResponseEntity<ApiResponseDto<SnapshotTransaction>> addTransactionAnnotation(
            @PathVariable("id") UUID id,
            @PathVariable("snapshotTransactionId") UUID snapshotTransactionId,
            @RequestBody @Valid AnnotationRequestDto request
    ) {
        SnapshotTransaction copy = snapshotService.addTransactionAnnotation(id, snapshotTransactionId, request.content(), request.createdBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponseDto.ok("Annotation added successfully", copy));
    }

    @GetMapping("/{id}/export")
    public ResponseEntity<String> export(
            @PathVariable("id") UUID id,
            @RequestParam(value = "format", required = false, defaultValue = "json") String format
    ) {
        ExportResult result = snapshotExporter.export(id, format);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.parseMediaType(result.contentType()), StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(result.fileName(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(result.data());
    }

    @PostMapping("/{id}/clone")
    public ResponseEntity<ApiResponseDto<FiscalBook>> cloneSnapshot(
            @PathVariable("id") UUID id,
            @RequestBody(required = false) CloneRequestDto request
    ) {
        CloneOverrides overrides = request != null ? request.toOverrides() : CloneOverrides.none();
        FiscalBook clone = rollbackCoordinator.cloneToNewBook(id, overrides);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponseDto.ok("Fiscal book cloned successfully", clone));
    }

    @PostMapping("/{id}/rollback")
    public ResponseEntity<ApiResponseDto<RollbackResult>> rollback(
            @PathVariable("id") UUID id,
            @RequestBody(required = false) RollbackRequestDto request
    ) {
        boolean createPreRollbackSnapshot = request == null || request.createPreRollbackSnapshotFlag();
        RollbackResult result = rollbackCoordinator.rollback(id, createPreRollbackSnapshot);
        return ResponseEntity.ok(ApiResponseDto.ok("Fiscal book rolled back successfully", result));
    }

    @PostMapping("/schedules/execute")
    public ResponseEntity<ApiResponseDto<ScheduleExecutionResult>> executeDueSchedules() {
        ScheduleExecutionResult result = scheduleEngine.executeDue();
        return ResponseEntity.ok(ApiResponseDto.ok("Scheduled snapshots executed", result));
    }
}
