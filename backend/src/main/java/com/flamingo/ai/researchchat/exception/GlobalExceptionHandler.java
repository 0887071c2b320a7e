package com.flamingo.ai.researchchat.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ConversationNotFoundException.class)
  public ResponseEntity<ApiError> handleConversationNotFound(
      ConversationNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isMessage() ? "message_not_found" : "conversation_not_found");
    String errorId = generateErrorId();
    log.warn("{} not found [{}]: {}", ex.getKind(), errorId, ex.getId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ex.isMessage() ? ApiError.MESSAGE_NOT_FOUND : ApiError.CONVERSATION_NOT_FOUND)
                .message(ex.getKind() + " not found")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(AuthorizationException.class)
  public ResponseEntity<ApiError> handleAuthorization(
      AuthorizationException ex, HttpServletRequest request) {

    incrementErrorCounter("access_denied");
    String errorId = generateErrorId();
    log.warn("Access denied [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.ACCESS_DENIED)
                .message("Access to this conversation is denied")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(SignatureVerificationException.class)
  public ResponseEntity<ApiError> handleSignatureVerification(
      SignatureVerificationException ex, HttpServletRequest request) {

    incrementErrorCounter("signature_invalid");
    String errorId = generateErrorId();
    log.warn("Rejected persisted payload [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.SIGNATURE_INVALID)
                .message("Payload signature could not be verified")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(GenerationConflictException.class)
  public ResponseEntity<ApiError> handleGenerationConflict(
      GenerationConflictException ex, HttpServletRequest request) {

    incrementErrorCounter("generation_conflict");
    String errorId = generateErrorId();
    log.warn("Generation conflict [{}]: {}", errorId, ex.getMessage());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.GENERATION_CONFLICT)
                .message("A response is already being generated")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<Map<String, Object>> handleRateLimit(RateLimitExceededException ex) {

    incrementErrorCounter("rate_limited");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "Rate limit exceeded");
    body.put("message", "Too many requests. Please try again later.");
    body.put("retryAfter", ex.getRetryAfterSeconds());

    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
        .body(body);
  }

  @ExceptionHandler(ScrapeException.class)
  public ResponseEntity<ApiError> handleScrape(ScrapeException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isBlocked() ? "scrape_blocked" : "scrape_error");
    String errorId = generateErrorId();
    log.warn("Scrape failed [{}]: {}", errorId, ex.getMessage());

    HttpStatus status = ex.isBlocked() ? HttpStatus.BAD_REQUEST : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ex.isBlocked() ? ApiError.SCRAPE_BLOCKED : ApiError.SCRAPE_FAILED)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ApiError> handleProvider(ProviderException ex, HttpServletRequest request) {

    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Provider error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.SEARCH_FAILED)
                .message("Search is temporarily unavailable. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;

    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(ex.getUserMessage())
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiError> handleValidationException(
      ValidationException ex, HttpServletRequest request) {
    return validationError(ex.getField() + ": " + ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    return validationError(message, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
    return validationError("Malformed request", request);
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

  private ResponseEntity<ApiError> validationError(String message, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Validation error [{}]: {}", errorId, message);

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
