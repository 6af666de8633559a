package com.flagship.live_event_ledger.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for live events.
 *
 * No setters: status changes go through {@link #applyTransition(LiveEvent)},
 * which only accepts a state the domain object produced. Counters change
 * through the record* methods, always while the row is locked.
 */
@Entity
@Table(name = "live_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LiveEventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "creator_id", nullable = false, updatable = false)
    private UUID creatorId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EventStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "access_type", nullable = false, updatable = false, length = 20)
    private AccessType accessType;

    @Column(name = "ticket_price_cents", updatable = false)
    private Long ticketPriceCents;

    @Column(name = "max_attendees", updatable = false)
    private Integer maxAttendees;

    @Column(name = "scheduled_start_at", nullable = false)
    private Instant scheduledStartAt;

    @Column(name = "actual_start_at")
    private Instant actualStartAt;

    @Column(name = "actual_end_at")
    private Instant actualEndAt;

    @Column(name = "total_revenue_cents", nullable = false)
    private long totalRevenueCents;

    @Column(name = "total_tips_cents", nullable = false)
    private long totalTipsCents;

    @Column(name = "total_attendees", nullable = false)
    private int totalAttendees;

    @Column(name = "peak_concurrent_viewers", nullable = false)
    private int peakConcurrentViewers;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public static LiveEventEntity fromDomain(LiveEvent event) {
        return new LiveEventEntity(
            event.getId(),
            event.getCreatorId(),
            event.getTitle(),
            event.getDescription(),
            event.getStatus(),
            event.getAccessType(),
            event.getTicketPriceCents(),
            event.getMaxAttendees(),
            event.getScheduledStartAt(),
            event.getActualStartAt(),
            event.getActualEndAt(),
            event.getTotalRevenueCents(),
            event.getTotalTipsCents(),
            event.getTotalAttendees(),
            event.getPeakConcurrentViewers(),
            event.getCreatedAt(),
            event.getUpdatedAt()
        );
    }

    public LiveEvent toDomain() {
        return LiveEvent.builder()
            .id(id)
            .creatorId(creatorId)
            .title(title)
            .description(description)
            .status(status)
            .accessType(accessType)
            .ticketPriceCents(ticketPriceCents)
            .maxAttendees(maxAttendees)
            .scheduledStartAt(scheduledStartAt)
            .actualStartAt(actualStartAt)
            .actualEndAt(actualEndAt)
            .totalRevenueCents(totalRevenueCents)
            .totalTipsCents(totalTipsCents)
            .totalAttendees(totalAttendees)
            .peakConcurrentViewers(peakConcurrentViewers)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the lifecycle fields of a transitioned domain object.
     *
     * @throws IllegalArgumentException if the domain object is a different event
     */
    public void applyTransition(LiveEvent transitioned) {
        if (!this.id.equals(transitioned.getId())) {
            throw new IllegalArgumentException(
                String.format("Cannot apply event %s to entity %s", transitioned.getId(), this.id));
        }
        this.status = transitioned.getStatus();
        this.actualStartAt = transitioned.getActualStartAt();
        this.actualEndAt = transitioned.getActualEndAt();
    }

    public void recordTicketSale(long priceCents) {
        this.totalRevenueCents += priceCents;
    }

    public void recordTicketRefund(long priceCents) {
        this.totalRevenueCents -= priceCents;
    }

    public void recordTip(long amountCents) {
        this.totalTipsCents += amountCents;
        this.totalRevenueCents += amountCents;
    }

    public void recordJoin(long activeViewers) {
        this.totalAttendees++;
        if (activeViewers > this.peakConcurrentViewers) {
            this.peakConcurrentViewers = (int) activeViewers;
        }
    }

    /**
     * Zeroes revenue once every ticket of a cancelled event is refunded.
     */
    public void resetRevenue() {
        this.totalRevenueCents = 0;
    }
}
