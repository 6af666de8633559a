package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EventClosedException extends LedgerException {

    private final UUID eventId;
    private final String status;

    public EventClosedException(UUID eventId, String status) {
        super(ErrorCode.EVENT_CLOSED, String.format("Event %s is %s and no longer moves money", eventId, status));
        this.eventId = eventId;
        this.status = status;
    }
}
