package com.flagship.live_event_ledger.event;

public enum SlotReservation {
    GRANTED,
    SOLD_OUT
}
