package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class EventNotPurchasableException extends LedgerException {

    private final UUID eventId;

    public EventNotPurchasableException(UUID eventId, String reason) {
        super(ErrorCode.EVENT_NOT_PURCHASABLE, "Cannot purchase ticket for event " + eventId + ": " + reason);
        this.eventId = eventId;
    }
}
