package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Capacity reached. Retryable: a refund can free a seat.
 */
@Getter
public class SoldOutException extends LedgerException {

    private final UUID eventId;
    private final int maxAttendees;

    public SoldOutException(UUID eventId, int maxAttendees) {
        super(ErrorCode.SOLD_OUT, String.format("Event %s is sold out (%d seats)", eventId, maxAttendees));
        this.eventId = eventId;
        this.maxAttendees = maxAttendees;
    }
}
