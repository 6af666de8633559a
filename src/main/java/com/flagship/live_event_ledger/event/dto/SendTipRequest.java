package com.flagship.live_event_ledger.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class SendTipRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    @JsonProperty("amount_cents")
    Long amountCents;

    /**
     * Defaults to the event's creator.
     */
    @JsonProperty("to_user_id")
    UUID toUserId;

    @Size(max = 500, message = "Message must be at most 500 characters")
    @JsonProperty("message")
    String message;

    @JsonProperty("anonymous")
    Boolean anonymous;

    public boolean isAnonymousTip() {
        return Boolean.TRUE.equals(anonymous);
    }
}
