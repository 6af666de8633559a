package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EventNotLiveException extends LedgerException {

    private final UUID eventId;
    private final String status;

    public EventNotLiveException(UUID eventId, String status) {
        super(ErrorCode.EVENT_NOT_LIVE, String.format("Event %s is not live (status=%s)", eventId, status));
        this.eventId = eventId;
        this.status = status;
    }
}
