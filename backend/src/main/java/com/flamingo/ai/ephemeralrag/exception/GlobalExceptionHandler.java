package com.flamingo.ai.ephemeralrag.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      SessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("session_not_found");
    String errorId = generateErrorId();
    log.warn("Session not found [{}]: {}", errorId, ex.getSessionId());

    return respond(HttpStatus.NOT_FOUND, errorId, ex, null, request);
  }

  @ExceptionHandler(SessionExpiredException.class)
  public ResponseEntity<ApiError> handleSessionExpired(
      SessionExpiredException ex, HttpServletRequest request) {

    incrementErrorCounter("session_expired");
    String errorId = generateErrorId();
    log.warn("Session expired [{}]: {} at {}", errorId, ex.getSessionId(), ex.getExpiredAt());

    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("expiredAt", ex.getExpiredAt());
    return respond(HttpStatus.GONE, errorId, ex, attributes, request);
  }

  @ExceptionHandler(SessionAccessDeniedException.class)
  public ResponseEntity<ApiError> handleSessionAccessDenied(
      SessionAccessDeniedException ex, HttpServletRequest request) {

    incrementErrorCounter("session_access_denied");
    String errorId = generateErrorId();
    log.warn(
        "Session access denied [{}]: session={}, user={}",
        errorId,
        ex.getSessionId(),
        ex.getUserId());

    return respond(HttpStatus.FORBIDDEN, errorId, ex, null, request);
  }

  @ExceptionHandler(ChunkNotFoundException.class)
  public ResponseEntity<ApiError> handleChunkNotFound(
      ChunkNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("chunk_not_found");
    String errorId = generateErrorId();
    log.warn(
        "Chunk not found [{}]: session={}, index={}",
        errorId,
        ex.getSessionId(),
        ex.getChunkIndex());

    return respond(HttpStatus.NOT_FOUND, errorId, ex, null, request);
  }

  @ExceptionHandler(QuotaExceededException.class)
  public ResponseEntity<ApiError> handleQuotaExceeded(
      QuotaExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("quota_exceeded");
    String errorId = generateErrorId();
    log.warn("Quota exceeded [{}]: {}", errorId, ex.getMessage());

    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("currentCount", ex.getCurrentCount());
    attributes.put("limit", ex.getLimit());
    attributes.put("remaining", ex.getRemaining());
    attributes.put("windowResetAt", ex.getWindowResetAt());
    return respond(HttpStatus.TOO_MANY_REQUESTS, errorId, ex, attributes, request);
  }

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(
      InvalidRequestException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return respond(HttpStatus.BAD_REQUEST, errorId, ex, null, request);
  }

  @ExceptionHandler(EmbeddingUnavailableException.class)
  public ResponseEntity<ApiError> handleEmbeddingUnavailable(
      EmbeddingUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isTimedOut() ? "embedding_timeout" : "embedding_unavailable");
    String errorId = generateErrorId();
    log.error("Embedding unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(HttpStatus.SERVICE_UNAVAILABLE, errorId, ex, null, request);
  }

  @ExceptionHandler(DimensionMismatchException.class)
  public ResponseEntity<ApiError> handleDimensionMismatch(
      DimensionMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("dimension_mismatch");
    String errorId = generateErrorId();
    log.error("Dimension mismatch [{}]: {}", errorId, ex.getMessage());

    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("expected", ex.getExpected());
    attributes.put("actual", ex.getActual());
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ex, attributes, request);
  }

  @ExceptionHandler(IndexStateException.class)
  public ResponseEntity<ApiError> handleIndexState(
      IndexStateException ex, HttpServletRequest request) {

    incrementErrorCounter("index_state");
    String errorId = generateErrorId();
    log.error("Index invariant violated [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(HttpStatus.INTERNAL_SERVER_ERROR, errorId, ex, null, request);
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

    return badRequest(errorId, message, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingRequestHeaderException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    String message =
        ex instanceof HttpMessageNotReadableException
            ? "Malformed request body"
            : ex.getMessage();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    return badRequest(errorId, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      StoreException ex,
      Map<String, Object> attributes,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ex.getCode())
                .message(ex.getUserMessage())
                .attributes(attributes)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> badRequest(
      String errorId, String message, HttpServletRequest request) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
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
