package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class TicketNotFoundException extends LedgerException {

    private final UUID ticketId;

    public TicketNotFoundException(UUID ticketId) {
        super(ErrorCode.TICKET_NOT_FOUND, "Ticket not found: " + ticketId);
        this.ticketId = ticketId;
    }
}
