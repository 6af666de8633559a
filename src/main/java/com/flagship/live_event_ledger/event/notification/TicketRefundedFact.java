package com.flagship.live_event_ledger.event.notification;

import com.flagship.live_event_ledger.event.EventTicket;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TicketRefundedFact implements LiveEventFact {
    UUID factId;
    UUID liveEventId;
    UUID ticketId;
    UUID fanId;
    long refundedCents;
    UUID refundTransactionId;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TicketRefunded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TicketRefundedFact from(EventTicket ticket, String reason) {
        return new TicketRefundedFact(
            UUID.randomUUID(),
            ticket.getEventId(),
            ticket.getId(),
            ticket.getFanId(),
            ticket.getPricePaidCents(),
            ticket.getRefundTransactionId(),
            reason,
            Instant.now()
        );
    }
}
