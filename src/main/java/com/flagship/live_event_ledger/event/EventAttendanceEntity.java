package com.flagship.live_event_ledger.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One viewing session. A user has at most one active session per event.
 */
@Entity
@Table(name = "event_attendance")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EventAttendanceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    @Column(name = "left_at")
    private Instant leftAt;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    public static EventAttendanceEntity open(UUID eventId, UUID userId) {
        return new EventAttendanceEntity(UUID.randomUUID(), eventId, userId, Instant.now(), null, true, null);
    }

    /**
     * Ends the session. Closing an inactive session does nothing.
     */
    public void close(Instant leftAt) {
        if (!active) {
            return;
        }
        this.active = false;
        this.leftAt = leftAt;
        this.durationSeconds = (int) Duration.between(joinedAt, leftAt).getSeconds();
    }

    public EventAttendance toDomain() {
        return new EventAttendance(id, eventId, userId, joinedAt, leftAt, active, durationSeconds);
    }
}
