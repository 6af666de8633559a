package com.flagship.live_event_ledger.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * The price the fan agreed to; must match the event's ticket price.
 */
@Value
public class PurchaseTicketRequest {

    @NotNull(message = "Price is required")
    @Positive(message = "Price must be positive")
    @JsonProperty("price_cents")
    Long priceCents;
}
