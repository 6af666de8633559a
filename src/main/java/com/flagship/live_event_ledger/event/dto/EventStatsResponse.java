package com.flagship.live_event_ledger.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.live_event_ledger.event.EventStats;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EventStatsResponse {

    @JsonProperty("event")
    EventResponse event;

    @JsonProperty("tickets_sold")
    long ticketsSold;

    @JsonProperty("total_tips")
    long totalTips;

    @JsonProperty("total_tips_amount_cents")
    long totalTipsAmountCents;

    @JsonProperty("active_attendees")
    long activeAttendees;

    public static EventStatsResponse from(EventStats stats) {
        return EventStatsResponse.builder()
            .event(EventResponse.from(stats.getEvent()))
            .ticketsSold(stats.getTicketsSold())
            .totalTips(stats.getTipCount())
            .totalTipsAmountCents(stats.getTipsAmountCents())
            .activeAttendees(stats.getActiveAttendees())
            .build();
    }
}
