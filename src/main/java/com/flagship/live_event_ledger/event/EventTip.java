package com.flagship.live_event_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EventTip {
    UUID id;
    UUID eventId;
    UUID fromUserId;
    UUID toUserId;
    long amountCents;
    String message;
    boolean anonymous;
    UUID transactionId;
    Instant tippedAt;
}
