package com.flagship.live_event_ledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Stable error codes returned to API clients.
 *
 * The prefix groups codes by owner: W = wallet, E = event, C = client input,
 * L = ledger integrity.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Wallet
    INSUFFICIENT_FUNDS("W001", "Insufficient balance"),
    WALLET_NOT_FOUND("W002", "Wallet not found"),

    // Event
    EVENT_NOT_FOUND("E001", "Event not found"),
    SOLD_OUT("E002", "Event is sold out"),
    DUPLICATE_TICKET("E003", "Ticket already purchased for this event"),
    EVENT_NOT_PURCHASABLE("E004", "Tickets cannot be purchased for this event"),
    EVENT_NOT_LIVE("E005", "Event is not live"),
    ACCESS_DENIED("E006", "Access to this event is denied"),
    TICKET_NOT_FOUND("E007", "Ticket not found"),
    NOT_EVENT_CREATOR("E008", "Only the event creator may perform this action"),
    ILLEGAL_TRANSITION("E009", "Event status transition is not allowed"),
    EVENT_CLOSED("E010", "Event has ended and no longer moves money"),

    // Client input
    INVALID_AMOUNT("C001", "Invalid transfer request"),
    IDEMPOTENCY_CONFLICT("C002", "Idempotency key was already used for a different request"),

    // Ledger integrity
    INTEGRITY_ERROR("L001", "Ledger integrity violation"),
    CANCELLATION_INCOMPLETE("L002", "Event cancellation did not complete");

    private final String code;
    private final String message;
}
