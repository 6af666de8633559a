package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EventNotFoundException extends LedgerException {

    private final UUID eventId;

    public EventNotFoundException(UUID eventId) {
        super(ErrorCode.EVENT_NOT_FOUND, "Event not found: " + eventId);
        this.eventId = eventId;
    }
}
