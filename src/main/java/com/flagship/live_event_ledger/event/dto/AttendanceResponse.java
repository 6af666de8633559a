package com.flagship.live_event_ledger.event.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.live_event_ledger.event.EventAttendance;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AttendanceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("joined_at")
    Instant joinedAt;

    @JsonProperty("left_at")
    Instant leftAt;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("duration_seconds")
    Integer durationSeconds;

    public static AttendanceResponse from(EventAttendance attendance) {
        return AttendanceResponse.builder()
            .id(attendance.getId())
            .eventId(attendance.getEventId())
            .userId(attendance.getUserId())
            .joinedAt(attendance.getJoinedAt())
            .leftAt(attendance.getLeftAt())
            .active(attendance.isActive())
            .durationSeconds(attendance.getDurationSeconds())
            .build();
    }
}
