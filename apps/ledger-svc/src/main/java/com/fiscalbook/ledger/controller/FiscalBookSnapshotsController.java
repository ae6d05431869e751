package com.fiscalbook.ledger.controller;

import com.fiscalbook.ledger.controller.dto.ApiResponseDto;
import com.fiscalbook.ledger.controller.dto.PaginationDto;
import com.fiscalbook.ledger.controller.dto.ScheduleUpdateRequestDto;
import com.fiscalbook.ledger.controller.dto.SnapshotCreateRequestDto;
import com.fiscalbook.ledger.model.FiscalBookSnapshot;
import com.fiscalbook.ledger.model.SnapshotSchedule;
import com.fiscalbook.ledger.snapshot.CaptureRequest;
import com.fiscalbook.ledger.snapshot.ScheduleEngine;
import com.fiscalbook.ledger.snapshot.SnapshotCapture;
import com.fiscalbook.ledger.snapshot.SnapshotService;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
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
@RequestMapping("/fiscal-book/{bookId}/snapshots")
public class FiscalBookSnapshotsController {

    private final SnapshotCapture snapshotCapture;
    private final SnapshotService snapshotService;
    private final ScheduleEngine scheduleEngine;

    public FiscalBookSnapshotsController(SnapshotCapture snapshotCapture,
                                         SnapshotService snapshotService,
                                         ScheduleEngine scheduleEngine) {
        this.snapshotCapture = snapshotCapture;
        this.snapshotService = snapshotService;
        this.scheduleEngine = scheduleEngine;
    }

    @PostMapping
    public ResponseEntity<ApiResponseDto<FiscalBookSnapshot>> createSnapshot(
            @PathVariable("bookId") UUID bookId,
            @RequestBody(required = false) @Valid SnapshotCreateRequestDto request
    ) {
        SnapshotCreateRequestDto body = request != null ? request : new SnapshotCreateRequestDto(null, null, null);
        FiscalBookSnapshot snapshot = snapshotCapture.capture(bookId,
                CaptureRequest.manual(body.name(), body.description(), body.tags()));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponseDto.ok("Snapshot created successfully", snapshot));
    }

    @GetMapping
    public ResponseEntity<ApiResponseDto<List<FiscalBookSnapshot>>> listSnapshots(
            @PathVariable("bookId") UUID bookId,
            @RequestParam(value = "tags", required = false) String tags,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "skip", required = false) Integer skip
    ) {
        var page = snapshotService.listSnapshots(bookId, parseTags(tags), limit, skip);
        return ResponseEntity.ok(ApiResponseDto.page(page.items(),
                PaginationDto.of(page.total(), page.items().size(), limit, skip)));
    }

    @DeleteMapping
    public ResponseEntity<ApiResponseDto<Map<String, Integer>>> deleteAllSnapshots(@PathVariable("bookId") UUID bookId) {
        int deleted = snapshotService.deleteAllForBook(bookId);
        return ResponseEntity.ok(ApiResponseDto.ok("Snapshots deleted successfully", Map.of("deletedCount", deleted)));
    }

    @GetMapping("/schedule")
    public ResponseEntity<ApiResponseDto<SnapshotSchedule>> getSchedule(@PathVariable("bookId") UUID bookId) {
        return scheduleEngine.getSchedule(bookId)
                .map(schedule -> ResponseEntity.ok(ApiResponseDto.ok(schedule)))
                .orElseGet(() -> ResponseEntity.ok(ApiResponseDto.ok("No schedule configured", null)));
    }

    @PutMapping("/schedule")
    public ResponseEntity<ApiResponseDto<SnapshotSchedule>> updateSchedule(
            @PathVariable("bookId") UUID bookId,
            @RequestBody @Valid ScheduleUpdateRequestDto request
    ) {
        SnapshotSchedule schedule = scheduleEngine.updateSchedule(bookId, request.toSettings());
        return ResponseEntity.ok(ApiResponseDto.ok("Schedule updated successfully", schedule));
    }

    @DeleteMapping("/schedule")
    public ResponseEntity<ApiResponseDto<SnapshotSchedule>> disableSchedule(@PathVariable("bookId") UUID bookId) {
        return ResponseEntity.ok(ApiResponseDto.ok("Schedule disabled", scheduleEngine.disableSchedule(bookId)));
    }

    static List<String> parseTags(String tags) {
        if (tags == null || tags.isBlank()) {
            return List.of();
        }
        return Arrays.stream(tags.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .toList();
    }
}
