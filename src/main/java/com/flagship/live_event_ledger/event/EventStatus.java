package com.flagship.live_event_ledger.event;

public enum EventStatus {
    SCHEDULED,
    LIVE,
    ENDED,
    CANCELLED
}
