package com.flagship.live_event_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to HTTP responses with a stable {@link ApiError} body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(LedgerException e) {
        ErrorCode errorCode = e.getErrorCode();
        HttpStatus status = statusFor(errorCode);

        switch (errorCode) {
            case INTEGRITY_ERROR, CANCELLATION_INCOMPLETE -> log.error("Ledger failure [{}]: {}", errorCode.getCode(), e.getMessage(), e);
            case SOLD_OUT -> log.info("Rejected [{}]: {}", errorCode.getCode(), e.getMessage());
            default -> log.warn("Rejected [{}]: {}", errorCode.getCode(), e.getMessage());
        }

        ApiError error = ApiError.builder()
            .code(errorCode.getCode())
            .error(errorCode.name())
            .message(errorCode == ErrorCode.INTEGRITY_ERROR ? errorCode.getMessage() : e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ApiError error = ApiError.builder()
            .error("Missing Required Header")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                fieldError -> fieldError.getField(),
                fieldError -> fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ApiError error = ApiError.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid parameter '{}': {}", e.getName(), e.getValue());

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .message("Invalid value for '" + e.getName() + "'")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .message("Request body is missing or malformed")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());

        ApiError error = ApiError.builder()
            .error("Invalid Request")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Unique-constraint backstops (ticket per fan, tip idempotency key) that
     * fire when two requests race past the application check.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());

        ApiError error = ApiError.builder()
            .error("Conflict")
            .message("Request conflicts with existing data")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorCode errorCode) {
        return switch (errorCode) {
            case WALLET_NOT_FOUND, EVENT_NOT_FOUND, TICKET_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INSUFFICIENT_FUNDS, SOLD_OUT, DUPLICATE_TICKET, ILLEGAL_TRANSITION, IDEMPOTENCY_CONFLICT -> HttpStatus.CONFLICT;
            case EVENT_NOT_PURCHASABLE, EVENT_NOT_LIVE, EVENT_CLOSED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case ACCESS_DENIED, NOT_EVENT_CREATOR -> HttpStatus.FORBIDDEN;
            case INVALID_AMOUNT -> HttpStatus.BAD_REQUEST;
            case INTEGRITY_ERROR, CANCELLATION_INCOMPLETE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
