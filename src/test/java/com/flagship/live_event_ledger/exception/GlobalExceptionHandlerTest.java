package com.flagship.live_event_ledger.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Every error code maps to an HTTP status")
    void testStatusFor_CoversEveryCode() {
        for (ErrorCode code : ErrorCode.values()) {
            assertNotNull(GlobalExceptionHandler.statusFor(code), "No status for " + code);
        }
    }

    @Test
    @DisplayName("Client-facing rejections map to their documented statuses")
    void testStatusFor_Mapping() {
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorCode.INSUFFICIENT_FUNDS));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorCode.SOLD_OUT));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorCode.DUPLICATE_TICKET));
        assertEquals(HttpStatus.NOT_FOUND, GlobalExceptionHandler.statusFor(ErrorCode.EVENT_NOT_FOUND));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(ErrorCode.EVENT_NOT_LIVE));
        assertEquals(HttpStatus.FORBIDDEN, GlobalExceptionHandler.statusFor(ErrorCode.ACCESS_DENIED));
        assertEquals(HttpStatus.BAD_REQUEST, GlobalExceptionHandler.statusFor(ErrorCode.INVALID_AMOUNT));
        assertEquals(HttpStatus.CONFLICT, GlobalExceptionHandler.statusFor(ErrorCode.IDEMPOTENCY_CONFLICT));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, GlobalExceptionHandler.statusFor(ErrorCode.EVENT_CLOSED));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, GlobalExceptionHandler.statusFor(ErrorCode.INTEGRITY_ERROR));
    }

    @Test
    @DisplayName("Sold out response carries the code and message")
    void testHandle_SoldOut() {
        UUID eventId = UUID.randomUUID();

        ResponseEntity<ApiError> response = handler.handleLedgerException(new SoldOutException(eventId, 100));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        ApiError body = response.getBody();
        assertNotNull(body);
        assertEquals("E002", body.getCode());
        assertEquals("SOLD_OUT", body.getError());
        assertTrue(body.getMessage().contains(eventId.toString()));
    }

    @Test
    @DisplayName("Integrity errors do not leak internal detail")
    void testHandle_IntegrityErrorHidesDetail() {
        ResponseEntity<ApiError> response = handler.handleLedgerException(
                new IntegrityException("Debit affected no row for wallet 1234"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertNotNull(response.getBody());
        assertFalse(response.getBody().getMessage().contains("1234"));
        assertEquals(ErrorCode.INTEGRITY_ERROR.getMessage(), response.getBody().getMessage());
    }
}
