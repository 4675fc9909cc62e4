package com.flagship.payout_settlement.payment.exception;

import com.flagship.payout_settlement.payment.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("A unique index violation from a concurrent write is a 409, not a 500")
    void dataIntegrityViolationIsConflict() {
        DataIntegrityViolationException e = new DataIntegrityViolationException("could not execute statement",
            new SQLException("duplicate key value violates unique constraint \"uq_payment_methods_default\""));

        ResponseEntity<ApiError> response = handler.handleDataIntegrityViolation(e);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("Concurrent Modification", response.getBody().getError());
        assertFalse(response.getBody().getMessage().contains("uq_payment_methods_default"));
    }

    @Test
    @DisplayName("A lost compare-and-set is a 409 carrying both statuses")
    void concurrencyConflictIsConflict() {
        UUID paymentId = UUID.randomUUID();

        ResponseEntity<ApiError> response = handler.handleConflict(
            new ConcurrencyConflictException(paymentId, PaymentStatus.PROCESSING, PaymentStatus.COMPLETED));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("PROCESSING", response.getBody().getDetails().get("expected_status"));
        assertEquals("COMPLETED", response.getBody().getDetails().get("actual_status"));
    }
}
