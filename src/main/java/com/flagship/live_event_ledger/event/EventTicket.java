package com.flagship.live_event_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A fan's admission to a ticketed event. Counts toward capacity until refunded.
 */
@Value
public class EventTicket {
    UUID id;
    UUID eventId;
    UUID fanId;
    long pricePaidCents;
    UUID transactionId;
    UUID refundTransactionId;
    Instant purchasedAt;
    Instant refundedAt;

    public boolean isRefunded() {
        return refundedAt != null;
    }
}
