package com.flagship.live_event_ledger.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.live_event_ledger.event.AccessType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.Instant;

@Value
public class CreateEventRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Access type is required")
    @JsonProperty("access_type")
    AccessType accessType;

    @Positive(message = "Ticket price must be positive")
    @JsonProperty("ticket_price_cents")
    Long ticketPriceCents;

    @Positive(message = "Max attendees must be positive")
    @JsonProperty("max_attendees")
    Integer maxAttendees;

    @NotNull(message = "Scheduled start is required")
    @JsonProperty("scheduled_start_at")
    Instant scheduledStartAt;
}
