package com.flagship.casino_ledger.api;

import com.flagship.casino_ledger.common.StorageConflictException;
import com.flagship.casino_ledger.economy.LoanRateLimitedException;
import com.flagship.casino_ledger.ledger.InsufficientFundsException;
import com.flagship.casino_ledger.session.GameAlreadyActiveException;
import com.flagship.casino_ledger.session.NoActiveGameException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP statuses with one error body shape.
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

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Invalid Request")
            .message("Request could not be read"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Invalid Request")
            .message(e.getMessage()));
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e) {
        log.warn("Insufficient funds: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorResponse.builder()
            .error("Insufficient Funds")
            .message(e.getMessage())
            .details(Map.of(
                "balance", Long.toString(e.getBalance()),
                "requested", Long.toString(e.getRequested()))));
    }

    @ExceptionHandler(GameAlreadyActiveException.class)
    public ResponseEntity<ErrorResponse> handleGameAlreadyActive(GameAlreadyActiveException e) {
        log.warn("Game already active: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
            .error("Game Already Active")
            .message(e.getMessage()));
    }

    @ExceptionHandler(NoActiveGameException.class)
    public ResponseEntity<ErrorResponse> handleNoActiveGame(NoActiveGameException e) {
        log.warn("No active game: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
            .error("No Active Game")
            .message(e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, ErrorResponse.builder()
            .error("Invalid State")
            .message(e.getMessage()));
    }

    @ExceptionHandler(LoanRateLimitedException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(LoanRateLimitedException e) {
        log.warn("Loan rate limited: {}", e.getMessage());
        ErrorResponse body = ErrorResponse.builder()
            .error("Rate Limited")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, Long.toString(e.getWindow().getSeconds()))
            .body(body);
    }

    @ExceptionHandler(StorageConflictException.class)
    public ResponseEntity<ErrorResponse> handleStorageConflict(StorageConflictException e) {
        log.error("Storage conflict after retries: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorResponse.builder()
            .error("Storage Busy")
            .message("The operation could not be completed, please try again"));
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
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
