package com.fiscalbook.ledger.controller;

import com.fiscalbook.ledger.controller.dto.ErrorResponseDto;
import com.fiscalbook.ledger.exception.ProtectedResourceException;
import com.fiscalbook.ledger.exception.ResourceNotFoundException;
import com.fiscalbook.ledger.exception.StorageException;
import com.fiscalbook.ledger.security.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> handleNotFound(ResourceNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), details(
                "resource", ex.getResource(),
                "id", ex.getId() == null ? null : ex.getId().toString()));
    }

    @ExceptionHandler(ProtectedResourceException.class)
    public ResponseEntity<ErrorResponseDto> handleProtected(ProtectedResourceException ex) {
        return build(HttpStatus.BAD_REQUEST, "PROTECTED_RESOURCE", ex.getMessage(), details(
                "snapshotId", ex.getSnapshotId().toString()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message.isEmpty() ? "Invalid request" : message, Map.of());
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponseDto> handleConstraintViolation(ConstraintViolationException ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException ex) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is missing or malformed",
                details("reason", ex.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponseDto> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", "Invalid value for " + ex.getName(),
                details("value", ex.getValue() == null ? null : ex.getValue().toString()));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponseDto> handleStorage(StorageException ex) {
        log.error("Storage failure on {}", route(), ex);
        String msg = ex.getMessage() != null ? ex.getMessage().toLowerCase() : "";
        if (msg.contains("relation \"fiscal_book_snapshots\" does not exist") || msg.contains("relation \"fiscal_books\" does not exist")) {
            return build(HttpStatus.INTERNAL_SERVER_ERROR, "DB_SCHEMA_MISSING", "Database schema not initialized", details(
                    "action", "Enable FISCALBOOK_DB_BOOTSTRAP=true once or apply db/bootstrap/schema.sql",
                    "reason", ex.getMessage()));
        }
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unhandled error on {}", route(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details("reason", ex.getMessage()));
    }

    private static String route() {
        return RequestContextHolder.get().map(RequestContextHolder.RequestContext::route).orElse("unknown route");
    }

    // Map.of rejects null values
    private static Map<String, Object> details(String... keysAndValues) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                details.put(keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return details;
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
