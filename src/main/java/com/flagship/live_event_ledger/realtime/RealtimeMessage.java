package com.flagship.live_event_ledger.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire shape of a room broadcast: {@code {type, data, timestamp}}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RealtimeMessage {

    public static final String TYPE_STREAM_UPDATE = "stream_update";
    public static final String TYPE_TIP = "tip";

    String type;
    Payload data;
    Instant timestamp;
    String correlationId;

    public static RealtimeMessage streamUpdate(Payload data) {
        return RealtimeMessage.builder()
            .type(TYPE_STREAM_UPDATE)
            .data(data)
            .timestamp(Instant.now())
            .build();
    }

    public static RealtimeMessage tip(Payload data) {
        return RealtimeMessage.builder()
            .type(TYPE_TIP)
            .data(data)
            .timestamp(Instant.now())
            .build();
    }

    public RealtimeMessage withCorrelationId(String correlationId) {
        return new RealtimeMessage(type, data, timestamp, correlationId);
    }

    /**
     * Union of the fields any broadcast carries; absent fields are omitted.
     */
    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Payload {
        UUID eventId;
        String status;
        String action;
        UUID userId;
        Long currentViewers;
        String title;
        String message;
        Instant actualStartAt;
        Instant actualEndAt;
        UUID tipId;
        Long amountCents;
        Boolean anonymous;
        UUID fromUserId;
        UUID toUserId;
    }
}
