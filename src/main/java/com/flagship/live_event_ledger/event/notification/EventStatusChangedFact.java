package com.flagship.live_event_ledger.event.notification;

import com.flagship.live_event_ledger.event.EventStatus;
import com.flagship.live_event_ledger.event.LiveEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle transition. A cancellation emits one fact when the status flips
 * and a {@code CancellationCompleted} fact once every ticket is refunded.
 */
@Value
public class EventStatusChangedFact implements LiveEventFact {
    UUID factId;
    UUID liveEventId;
    UUID creatorId;
    EventStatus previousStatus;
    EventStatus status;
    String eventType;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EventStatusChanged";
    public static final String CANCELLATION_COMPLETED = "CancellationCompleted";

    public static EventStatusChangedFact of(EventStatus previousStatus, LiveEvent event) {
        return new EventStatusChangedFact(UUID.randomUUID(), event.getId(), event.getCreatorId(),
                previousStatus, event.getStatus(), EVENT_TYPE, Instant.now());
    }

    public static EventStatusChangedFact cancellationCompleted(LiveEvent event) {
        return new EventStatusChangedFact(UUID.randomUUID(), event.getId(), event.getCreatorId(),
                EventStatus.CANCELLED, EventStatus.CANCELLED, CANCELLATION_COMPLETED, Instant.now());
    }
}
