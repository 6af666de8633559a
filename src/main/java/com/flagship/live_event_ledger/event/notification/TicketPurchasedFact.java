package com.flagship.live_event_ledger.event.notification;

import com.flagship.live_event_ledger.event.EventTicket;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TicketPurchasedFact implements LiveEventFact {
    UUID factId;
    UUID liveEventId;
    UUID ticketId;
    UUID fanId;
    long pricePaidCents;
    UUID transactionId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TicketPurchased";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TicketPurchasedFact from(EventTicket ticket) {
        return new TicketPurchasedFact(
            UUID.randomUUID(),
            ticket.getEventId(),
            ticket.getId(),
            ticket.getFanId(),
            ticket.getPricePaidCents(),
            ticket.getTransactionId(),
            Instant.now()
        );
    }
}
