package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class IllegalEventTransitionException extends LedgerException {

    private final UUID eventId;
    private final String fromStatus;
    private final String toStatus;

    public IllegalEventTransitionException(UUID eventId, String fromStatus, String toStatus) {
        super(ErrorCode.ILLEGAL_TRANSITION,
                String.format("Cannot move event %s from %s to %s", eventId, fromStatus, toStatus));
        this.eventId = eventId;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
    }
}
