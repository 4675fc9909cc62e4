package com.flagship.payout_settlement.payment.exception;

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
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the payout exception hierarchy to HTTP responses.
 *
 * Settlement failures are reported only after the FAILED status has been
 * persisted, so a 422/502 here never means the payment was left untouched.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
            "Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", e.getMessage(), null);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ApiError> handleUnauthorized(UnauthorizedException e) {
        log.warn("Unauthorized: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(ConcurrencyConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConcurrencyConflictException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("payment_id", String.valueOf(e.getPaymentId()));
        details.put("expected_status", String.valueOf(e.getExpectedStatus()));
        details.put("actual_status", String.valueOf(e.getActualStatus()));
        return respond(HttpStatus.CONFLICT, "Concurrent Modification", e.getMessage(), details);
    }

    /**
     * A concurrent writer won a unique index first, e.g. two default payout
     * methods or two primary funding accounts promoted at once.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        log.warn("Conflicting concurrent update: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "Concurrent Modification",
            "The resource was changed by a concurrent request. Re-read it before retrying.", null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiError> handleInvalidTransition(InvalidTransitionException e) {
        log.warn("Invalid transition: {}", e.getMessage());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("current_status", String.valueOf(e.getCurrentStatus()));
        if (e.getTargetStatus() != null) {
            details.put("target_status", e.getTargetStatus().name());
        }
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), details);
    }

    @ExceptionHandler({InsufficientFundsException.class, BelowMinimumAmountException.class})
    public ResponseEntity<ApiError> handleUnprocessableSettlement(SettlementException e) {
        log.warn("Settlement rejected: paymentId={}, kind={}, message={}",
            e.getPaymentId(), e.getFailureKind(), e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Settlement Failed", e.getMessage(), settlementDetails(e));
    }

    @ExceptionHandler(GenericSettlementException.class)
    public ResponseEntity<ApiError> handleSettlementError(GenericSettlementException e) {
        log.error("Settlement failed: paymentId={}, message={}", e.getPaymentId(), e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Settlement Failed", e.getMessage(), settlementDetails(e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static Map<String, String> settlementDetails(SettlementException e) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("payment_id", String.valueOf(e.getPaymentId()));
        details.put("failure_kind", String.valueOf(e.getFailureKind()));
        return details;
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                                    Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
