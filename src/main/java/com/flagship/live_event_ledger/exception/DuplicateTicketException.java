package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class DuplicateTicketException extends LedgerException {

    private final UUID eventId;
    private final UUID fanId;

    public DuplicateTicketException(UUID eventId, UUID fanId) {
        super(ErrorCode.DUPLICATE_TICKET, "Ticket already purchased for event " + eventId);
        this.eventId = eventId;
        this.fanId = fanId;
    }
}
