package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class NotEventCreatorException extends LedgerException {

    private final UUID eventId;
    private final UUID userId;

    public NotEventCreatorException(UUID eventId, UUID userId) {
        super(ErrorCode.NOT_EVENT_CREATOR, "User " + userId + " is not the creator of event " + eventId);
        this.eventId = eventId;
        this.userId = userId;
    }
}
