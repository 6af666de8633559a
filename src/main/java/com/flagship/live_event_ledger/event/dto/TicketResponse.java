package com.flagship.live_event_ledger.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.live_event_ledger.event.EventTicket;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TicketResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("fan_id")
    UUID fanId;

    @JsonProperty("price_paid_cents")
    long pricePaidCents;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("refund_transaction_id")
    UUID refundTransactionId;

    @JsonProperty("purchased_at")
    Instant purchasedAt;

    @JsonProperty("refunded_at")
    Instant refundedAt;

    public static TicketResponse from(EventTicket ticket) {
        return TicketResponse.builder()
            .id(ticket.getId())
            .eventId(ticket.getEventId())
            .fanId(ticket.getFanId())
            .pricePaidCents(ticket.getPricePaidCents())
            .transactionId(ticket.getTransactionId())
            .refundTransactionId(ticket.getRefundTransactionId())
            .purchasedAt(ticket.getPurchasedAt())
            .refundedAt(ticket.getRefundedAt())
            .build();
    }
}
