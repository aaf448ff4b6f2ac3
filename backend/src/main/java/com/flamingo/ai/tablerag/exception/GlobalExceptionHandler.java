package com.flamingo.ai.tablerag.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(IndexCorruptedException.class)
  public ResponseEntity<ApiError> handleIndexCorrupted(
      IndexCorruptedException ex, HttpServletRequest request) {

    incrementErrorCounter("index_corrupted");
    String errorId = generateErrorId();
    log.error("Index corrupted [{}] at {}: {}", errorId, ex.getIndexDir(), ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INDEX_CORRUPTED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(EmbeddingModelMismatchException.class)
  public ResponseEntity<ApiError> handleEmbeddingMismatch(
      EmbeddingModelMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_mismatch");
    String errorId = generateErrorId();
    log.error("Embedding model mismatch [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.EMBEDDING_MISMATCH,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(TableImageNotFoundException.class)
  public ResponseEntity<ApiError> handleTableImageNotFound(
      TableImageNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("table_not_found");
    String errorId = generateErrorId();
    log.warn("Table image not found [{}]: {}", errorId, ex.getFileName());

    return error(
        HttpStatus.NOT_FOUND, errorId, ApiError.TABLE_NOT_FOUND, "Table image not found", request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    incrementErrorCounter("llm_error");
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.LLM_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
