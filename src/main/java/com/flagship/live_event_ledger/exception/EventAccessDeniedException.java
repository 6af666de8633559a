package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EventAccessDeniedException extends LedgerException {

    private final UUID eventId;
    private final UUID userId;

    public EventAccessDeniedException(UUID eventId, UUID userId, String reason) {
        super(ErrorCode.ACCESS_DENIED, "Access denied to event " + eventId + ": " + reason);
        this.eventId = eventId;
        this.userId = userId;
    }
}
