package com.flamingo.ai.resumescreener.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DuplicateIdentifierException.class)
  public ResponseEntity<ApiError> handleDuplicateIdentifier(
      DuplicateIdentifierException ex, HttpServletRequest request) {

    incrementErrorCounter("duplicate_candidate");
    String errorId = generateErrorId();
    log.warn("Duplicate candidate identifier [{}]: {}", errorId, ex.getCandidateId());

    return build(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.DUPLICATE_CANDIDATE,
        "Candidate identifier already exists, please retry the upload",
        request);
  }

  @ExceptionHandler(InsufficientCandidatesException.class)
  public ResponseEntity<ApiError> handleInsufficientCandidates(
      InsufficientCandidatesException ex, HttpServletRequest request) {

    incrementErrorCounter("insufficient_candidates");
    String errorId = generateErrorId();
    log.warn(
        "Insufficient candidates for comparison [{}]: requested={}, resolved={}",
        errorId,
        ex.getRequested(),
        ex.getResolved());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INSUFFICIENT_CANDIDATES,
        "At least 2 valid candidates required for comparison",
        request);
  }

  @ExceptionHandler(InvalidRequirementException.class)
  public ResponseEntity<ApiError> handleInvalidRequirement(
      InvalidRequirementException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_requirement");
    String errorId = generateErrorId();
    log.warn("Invalid requirement [{}]: {} - {}", errorId, ex.getField(), ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_REQUIREMENT,
        ex.getField() + ": " + ex.getMessage(),
        request);
  }

  @ExceptionHandler(UnsupportedDocumentException.class)
  public ResponseEntity<ApiError> handleUnsupportedDocument(
      UnsupportedDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_document");
    String errorId = generateErrorId();
    log.warn("Unsupported documents [{}]: {}", errorId, ex.getFileNames());

    return build(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        errorId,
        ApiError.UNSUPPORTED_DOCUMENT,
        "No valid documents uploaded",
        request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(UploadLimitExceededException.class)
  public ResponseEntity<ApiError> handleUploadLimitExceeded(
      UploadLimitExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_limit_exceeded");
    String errorId = generateErrorId();
    log.warn("Upload limit exceeded [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.UPLOAD_LIMIT_EXCEEDED,
        "Too many files, at most " + ex.getMaxFiles() + " per upload",
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

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Malformed request body or missing part",
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("upload_limit_exceeded");
    String errorId = generateErrorId();
    log.warn("Upload size exceeded [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.UPLOAD_LIMIT_EXCEEDED,
        "Uploaded files exceed the maximum size",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
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
