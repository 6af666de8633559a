package com.flagship.live_event_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class EventAttendance {
    UUID id;
    UUID eventId;
    UUID userId;
    Instant joinedAt;
    Instant leftAt;
    boolean active;
    Integer durationSeconds;
}
