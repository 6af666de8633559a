package com.flagship.live_event_ledger.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.live_event_ledger.event.AccessType;
import com.flagship.live_event_ledger.event.EventStatus;
import com.flagship.live_event_ledger.event.LiveEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EventResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("creator_id")
    UUID creatorId;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    EventStatus status;

    @JsonProperty("access_type")
    AccessType accessType;

    @JsonProperty("ticket_price_cents")
    Long ticketPriceCents;

    @JsonProperty("max_attendees")
    Integer maxAttendees;

    @JsonProperty("scheduled_start_at")
    Instant scheduledStartAt;

    @JsonProperty("actual_start_at")
    Instant actualStartAt;

    @JsonProperty("actual_end_at")
    Instant actualEndAt;

    @JsonProperty("total_revenue_cents")
    long totalRevenueCents;

    @JsonProperty("total_tips_cents")
    long totalTipsCents;

    @JsonProperty("total_attendees")
    int totalAttendees;

    @JsonProperty("peak_concurrent_viewers")
    int peakConcurrentViewers;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EventResponse from(LiveEvent event) {
        return EventResponse.builder()
            .id(event.getId())
            .creatorId(event.getCreatorId())
            .title(event.getTitle())
            .description(event.getDescription())
            .status(event.getStatus())
            .accessType(event.getAccessType())
            .ticketPriceCents(event.getTicketPriceCents())
            .maxAttendees(event.getMaxAttendees())
            .scheduledStartAt(event.getScheduledStartAt())
            .actualStartAt(event.getActualStartAt())
            .actualEndAt(event.getActualEndAt())
            .totalRevenueCents(event.getTotalRevenueCents())
            .totalTipsCents(event.getTotalTipsCents())
            .totalAttendees(event.getTotalAttendees())
            .peakConcurrentViewers(event.getPeakConcurrentViewers())
            .createdAt(event.getCreatedAt())
            .build();
    }
}
