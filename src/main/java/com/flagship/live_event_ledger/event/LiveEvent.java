package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.exception.IllegalEventTransitionException;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Live event with an explicit lifecycle:
 * SCHEDULED -> LIVE -> ENDED, and SCHEDULED | LIVE -> CANCELLED.
 *
 * Transitions return a new instance. Illegal transitions throw
 * {@link IllegalEventTransitionException}; ENDED and CANCELLED are terminal.
 */
@Value
@Builder(toBuilder = true)
public class LiveEvent {
    UUID id;
    UUID creatorId;
    String title;
    String description;
    EventStatus status;
    AccessType accessType;
    Long ticketPriceCents;
    Integer maxAttendees;
    Instant scheduledStartAt;
    Instant actualStartAt;
    Instant actualEndAt;
    long totalRevenueCents;
    long totalTipsCents;
    int totalAttendees;
    int peakConcurrentViewers;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new event in SCHEDULED status with zeroed counters.
     *
     * @throws IllegalArgumentException if the title is blank, a ticketed event
     *         has no positive price, or the capacity is not positive
     */
    public static LiveEvent create(UUID creatorId, String title, String description, AccessType accessType,
                                   Long ticketPriceCents, Integer maxAttendees, Instant scheduledStartAt) {
        if (creatorId == null) {
            throw new IllegalArgumentException("Creator ID is required");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Event title is required");
        }
        if (accessType == null) {
            throw new IllegalArgumentException("Access type is required");
        }
        if (scheduledStartAt == null) {
            throw new IllegalArgumentException("Scheduled start is required");
        }
        if (accessType == AccessType.TICKETED && (ticketPriceCents == null || ticketPriceCents <= 0)) {
            throw new IllegalArgumentException("Ticketed events need a positive ticket price");
        }
        if (ticketPriceCents != null && ticketPriceCents <= 0) {
            throw new IllegalArgumentException("Ticket price must be positive");
        }
        if (maxAttendees != null && maxAttendees <= 0) {
            throw new IllegalArgumentException("Max attendees must be positive");
        }

        Instant now = Instant.now();
        return LiveEvent.builder()
            .id(UUID.randomUUID())
            .creatorId(creatorId)
            .title(title.trim())
            .description(description)
            .status(EventStatus.SCHEDULED)
            .accessType(accessType)
            .ticketPriceCents(accessType == AccessType.TICKETED ? ticketPriceCents : null)
            .maxAttendees(maxAttendees)
            .scheduledStartAt(scheduledStartAt)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public LiveEvent start() {
        requireTransition(EventStatus.LIVE);
        Instant now = Instant.now();
        return toBuilder()
            .status(EventStatus.LIVE)
            .actualStartAt(now)
            .updatedAt(now)
            .build();
    }

    public LiveEvent end() {
        requireTransition(EventStatus.ENDED);
        Instant now = Instant.now();
        return toBuilder()
            .status(EventStatus.ENDED)
            .actualEndAt(now)
            .updatedAt(now)
            .build();
    }

    public LiveEvent cancel() {
        requireTransition(EventStatus.CANCELLED);
        return toBuilder()
            .status(EventStatus.CANCELLED)
            .updatedAt(Instant.now())
            .build();
    }

    public boolean canTransitionTo(EventStatus target) {
        return switch (this.status) {
            case SCHEDULED -> target == EventStatus.LIVE || target == EventStatus.CANCELLED;
            case LIVE -> target == EventStatus.ENDED || target == EventStatus.CANCELLED;
            case ENDED, CANCELLED -> false;
        };
    }

    public boolean isTerminal() {
        return status == EventStatus.ENDED || status == EventStatus.CANCELLED;
    }

    public boolean isLive() {
        return status == EventStatus.LIVE;
    }

    /**
     * Tickets are sold for ticketed events that have not ended or been cancelled.
     */
    public boolean acceptsTicketPurchase() {
        return accessType == AccessType.TICKETED
            && (status == EventStatus.SCHEDULED || status == EventStatus.LIVE);
    }

    public boolean isCreator(UUID userId) {
        return creatorId.equals(userId);
    }

    private void requireTransition(EventStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalEventTransitionException(id, status.name(), target.name());
        }
    }
}
