package com.screening.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses with an {@link ErrorResponse} body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidIdentityException.class)
    public ResponseEntity<ErrorResponse> handleInvalidIdentity(
            InvalidIdentityException ex, HttpServletRequest request) {
        log.warn("Invalid identity: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "INVALID_IDENTITY", ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.toList());
        log.warn("Request validation failed: {}", details);
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request validation failed", request, details, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body is malformed", request, null, null);
    }

    @ExceptionHandler(SubjectNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSubjectNotFound(
            SubjectNotFoundException ex, HttpServletRequest request) {
        log.warn("Subject not found: {}", ex.getSubjectId());
        return respond(HttpStatus.NOT_FOUND, "SUBJECT_NOT_FOUND", ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(UnauthorizedTriggerException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(
            UnauthorizedTriggerException ex, HttpServletRequest request) {
        log.warn("Rejected internal call to {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Unauthorized", request, null, null);
    }

    @ExceptionHandler(BatchAlreadyRunningException.class)
    public ResponseEntity<ErrorResponse> handleBatchRunning(
            BatchAlreadyRunningException ex, HttpServletRequest request) {
        log.warn("Rescreen trigger rejected: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "BATCH_ALREADY_RUNNING", ex.getMessage(), request, null, null);
    }

    @ExceptionHandler(PersistenceFailureException.class)
    public ResponseEntity<ErrorResponse> handlePersistenceFailure(
            PersistenceFailureException ex, HttpServletRequest request) {
        log.error("Disposition not stored for subject {}", ex.getSubjectId(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "PERSISTENCE_FAILURE",
                "Assessment computed but could not be stored; retry the request", request, null, ex.getAssessment());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", request, null, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message,
                                                  HttpServletRequest request, List<String> details,
                                                  Object assessment) {
        ErrorResponse error = ErrorResponse.builder()
                .errorCode(errorCode)
                .message(message)
                .status(status.value())
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .details(details)
                .assessment(assessment)
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
