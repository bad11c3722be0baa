package com.backend.artscan.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps every failure onto a single terminal error body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({ArtworkNotFoundException.class, IssueReportNotFoundException.class,
            MuseumNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(ArtScanException e) {
        return buildError(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), false);
    }

    @ExceptionHandler(InvalidImageException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidImage(InvalidImageException e) {
        return buildError(HttpStatus.BAD_REQUEST, "INVALID_IMAGE", e.getMessage(), false);
    }

    @ExceptionHandler(EmbeddingUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleEmbeddingUnavailable(EmbeddingUnavailableException e) {
        log.warn("Scan failed, embedding unavailable: {}", e.getMessage());
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, "EMBEDDING_UNAVAILABLE", e.getMessage(), e.isRetryable());
    }

    @ExceptionHandler(AnalysisUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleAnalysisUnavailable(AnalysisUnavailableException e) {
        log.warn("Scan failed, analysis unavailable: {}", e.getMessage());
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, "ANALYSIS_UNAVAILABLE", e.getMessage(), e.isRetryable());
    }

    @ExceptionHandler(CatalogUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleCatalogUnavailable(CatalogUnavailableException e) {
        log.warn("Scan failed, catalog busy: {}", e.getMessage());
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, "CATALOG_UNAVAILABLE", e.getMessage(), e.isRetryable());
    }

    @ExceptionHandler(StoreConflictException.class)
    public ResponseEntity<Map<String, Object>> handleStoreConflict(StoreConflictException e) {
        log.warn("Scan failed, store conflict: {}", e.getMessage());
        return buildError(HttpStatus.CONFLICT, "STORE_CONFLICT", e.getMessage(), e.isRetryable());
    }

    @ExceptionHandler(ScanCancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(ScanCancelledException e) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, "CANCELLED", e.getMessage(), true);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage(), false);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationError(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", details, false);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException e) {
        String details = e.getConstraintViolations().stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .collect(Collectors.joining(", "));
        return buildError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", details, false);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(IllegalStateException e) {
        return buildError(HttpStatus.CONFLICT, "CONFLICT", e.getMessage(), false);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleTooLarge(MaxUploadSizeExceededException e) {
        return buildError(HttpStatus.PAYLOAD_TOO_LARGE, "INVALID_IMAGE", "Image exceeds the upload limit", false);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception e) {
        log.error("Unhandled error", e);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "System error. Please try again later.", false);
    }

    private ResponseEntity<Map<String, Object>> buildError(HttpStatus status, String code, String message,
                                                           boolean retryable) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        body.put("retryable", retryable);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
