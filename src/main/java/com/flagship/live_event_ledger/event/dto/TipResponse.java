package com.flagship.live_event_ledger.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.live_event_ledger.event.EventTip;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TipResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("event_id")
    UUID eventId;

    /**
     * Null for anonymous tips.
     */
    @JsonProperty("from_user_id")
    UUID fromUserId;

    @JsonProperty("to_user_id")
    UUID toUserId;

    @JsonProperty("amount_cents")
    long amountCents;

    @JsonProperty("message")
    String message;

    @JsonProperty("anonymous")
    boolean anonymous;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("tipped_at")
    Instant tippedAt;

    public static TipResponse from(EventTip tip) {
        return TipResponse.builder()
            .id(tip.getId())
            .eventId(tip.getEventId())
            .fromUserId(tip.isAnonymous() ? null : tip.getFromUserId())
            .toUserId(tip.getToUserId())
            .amountCents(tip.getAmountCents())
            .message(tip.getMessage())
            .anonymous(tip.isAnonymous())
            .transactionId(tip.getTransactionId())
            .tippedAt(tip.getTippedAt())
            .build();
    }
}
