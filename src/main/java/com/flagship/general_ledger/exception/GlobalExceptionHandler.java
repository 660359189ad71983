package com.flagship.general_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates exceptions into {@link ApiError} responses.
 *
 * Ledger errors carry their own error code; the HTTP status is chosen here
 * so the domain layer stays free of web concerns.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidStateException.class, PeriodClosedException.class, DuplicatePeriodException.class})
    public ResponseEntity<ApiError> handleConflict(LedgerException e) {
        log.warn("Rejected state transition [{}]: {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(UnbalancedPeriodException.class)
    public ResponseEntity<ApiError> handleUnbalanced(UnbalancedPeriodException e) {
        log.warn("Period close blocked: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .details(Map.of(
                "totalDebits", String.valueOf(e.getTotalDebits()),
                "totalCredits", String.valueOf(e.getTotalCredits())))
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error);
    }

    @ExceptionHandler(NotReconciledException.class)
    public ResponseEntity<ApiError> handleNotReconciled(NotReconciledException e) {
        log.warn("Reconciliation incomplete: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ApiError error = ApiError.builder()
            .error(ValidationException.CODE)
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        ApiError error = ApiError.builder()
            .error(ValidationException.CODE)
            .message("Required parameter '" + e.getParameterName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e) {
        log.warn("Request validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error(ValidationException.CODE)
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error(ValidationException.CODE)
            .message("Malformed request")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());

        ApiError error = ApiError.builder()
            .error(InvalidStateException.CODE)
            .message("Request conflicts with existing data")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, LedgerException e) {
        ApiError error = ApiError.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
