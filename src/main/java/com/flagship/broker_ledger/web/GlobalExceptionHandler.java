package com.flagship.broker_ledger.web;

import com.flagship.broker_ledger.account.AccountNotFoundException;
import com.flagship.broker_ledger.invariant.InvariantViolationException;
import com.flagship.broker_ledger.ledger.ConcurrencyConflictException;
import com.flagship.broker_ledger.ledger.FundingBlockedException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions from the non-settlement operations to error bodies.
 * Settlements report failures through their result instead.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Invalid Request")
            .message("Request body could not be read"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage()));
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AccountNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, ErrorResponse.builder()
            .error("Not Found")
            .message(e.getMessage()));
    }

    @ExceptionHandler(FundingBlockedException.class)
    public ResponseEntity<ErrorResponse> handleFundingBlocked(FundingBlockedException e) {
        log.warn("{}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
            .error("Funding Blocked")
            .message(e.getMessage()));
    }

    @ExceptionHandler({ConcurrencyConflictException.class})
    public ResponseEntity<ErrorResponse> handleConcurrencyConflict(ConcurrencyConflictException e) {
        log.warn("Concurrency conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
            .error("Concurrency Conflict")
            .message(e.getMessage())
            .retryable(true));
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateKeyException e) {
        log.warn("Duplicate key: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
            .error("Already Exists")
            .message("A record with the same identity already exists"));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
            .error("Invalid State")
            .message(e.getMessage()));
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e) {
        log.error("Operation rolled back, invariant violated: accountId={}, violations={}",
            e.getAccountId(), e.getViolations(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.builder()
            .error("Invariant Violation")
            .message(e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorResponse.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred"));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse.ErrorResponseBuilder body) {
        return ResponseEntity.status(status).body(body.timestamp(Instant.now()).build());
    }

    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Boolean retryable;
        Instant timestamp;
    }
}
