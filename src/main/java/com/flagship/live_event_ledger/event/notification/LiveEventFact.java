package com.flagship.live_event_ledger.event.notification;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact about a live event, written to the outbox in the transaction that
 * made it true and published to the live-events topic keyed by event ID.
 */
public interface LiveEventFact {

    String AGGREGATE_TYPE = "LiveEvent";

    /**
     * Unique per fact; consumers deduplicate on it.
     */
    UUID getFactId();

    UUID getLiveEventId();

    Instant getOccurredAt();

    String getEventType();
}
