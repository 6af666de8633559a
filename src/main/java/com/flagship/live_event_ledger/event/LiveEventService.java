package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.event.notification.EventStatusChangedFact;
import com.flagship.live_event_ledger.event.notification.LiveEventFact;
import com.flagship.live_event_ledger.exception.CancellationIncompleteException;
import com.flagship.live_event_ledger.exception.EventNotFoundException;
import com.flagship.live_event_ledger.exception.IllegalEventTransitionException;
import com.flagship.live_event_ledger.exception.NotEventCreatorException;
import com.flagship.live_event_ledger.observability.CorrelationContext;
import com.flagship.live_event_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Event lifecycle and read side.
 *
 * Every transition locks the event row, checks the caller is the creator,
 * lets {@link LiveEvent} validate the transition, writes the outbox fact in
 * the same transaction and queues the room broadcast for after commit.
 * Cancellation is split in two steps; see {@link EventCancellationService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiveEventService {

    static final int MAX_LIST_SIZE = 100;

    private final LiveEventRepository eventRepository;
    private final EventTicketRepository ticketRepository;
    private final EventTipRepository tipRepository;
    private final EventAttendanceRepository attendanceRepository;
    private final OutboxService outboxService;
    private final EventBroadcasts broadcasts;

    @Transactional
    public LiveEvent createEvent(UUID creatorId, String title, String description, AccessType accessType,
                                 Long ticketPriceCents, Integer maxAttendees, Instant scheduledStartAt) {
        LiveEvent event = LiveEvent.create(creatorId, title, description, accessType,
                ticketPriceCents, maxAttendees, scheduledStartAt);
        LiveEvent saved = eventRepository.save(LiveEventEntity.fromDomain(event)).toDomain();

        log.info("Event created: eventId={}, creatorId={}, accessType={}, maxAttendees={}",
                saved.getId(), creatorId, accessType, maxAttendees);
        return saved;
    }

    @Transactional
    public LiveEvent startEvent(UUID eventId, UUID creatorId) {
        CorrelationContext.putOperation(eventId, creatorId);
        try {
            LiveEventEntity entity = lockOwnedEvent(eventId, creatorId);
            LiveEvent current = entity.toDomain();
            LiveEvent started = current.start();
            entity.applyTransition(started);

            recordTransition(current.getStatus(), started);
            broadcasts.started(started);
            log.info("Event started: eventId={}", eventId);
            return started;
        } finally {
            CorrelationContext.clearOperation();
        }
    }

    /**
     * Ends a live event and closes every open attendance.
     */
    @Transactional
    public LiveEvent endEvent(UUID eventId, UUID creatorId) {
        CorrelationContext.putOperation(eventId, creatorId);
        try {
            LiveEventEntity entity = lockOwnedEvent(eventId, creatorId);
            LiveEvent current = entity.toDomain();
            LiveEvent ended = current.end();
            entity.applyTransition(ended);

            int closed = closeAttendance(eventId, ended.getActualEndAt());
            recordTransition(current.getStatus(), ended);
            broadcasts.ended(ended);
            log.info("Event ended: eventId={}, closedAttendance={}", eventId, closed);
            return ended;
        } finally {
            CorrelationContext.clearOperation();
        }
    }

    /**
     * First step of a cancellation: flips the event to CANCELLED and commits,
     * which stops new purchases, joins and tips. An event that is already
     * CANCELLED is returned as is so that a retried cancellation can resume.
     */
    @Transactional
    public LiveEvent beginCancellation(UUID eventId, UUID creatorId) {
        LiveEventEntity entity = lockOwnedEvent(eventId, creatorId);
        LiveEvent current = entity.toDomain();
        if (current.getStatus() == EventStatus.CANCELLED) {
            log.warn("Event {} already cancelled, resuming outstanding refunds", eventId);
            return current;
        }

        LiveEvent cancelled = current.cancel();
        entity.applyTransition(cancelled);
        int closed = closeAttendance(eventId, cancelled.getUpdatedAt());
        recordTransition(current.getStatus(), cancelled);

        log.info("Event cancelled, refunds pending: eventId={}, closedAttendance={}", eventId, closed);
        return cancelled;
    }

    /**
     * Last step of a cancellation: zeroes revenue once no ticket is left
     * unrefunded and tells the room.
     *
     * @throws CancellationIncompleteException if a ticket is still outstanding
     */
    @Transactional
    public LiveEvent completeCancellation(UUID eventId) {
        LiveEventEntity entity = eventRepository.findByIdForUpdate(eventId)
            .orElseThrow(() -> new EventNotFoundException(eventId));
        if (entity.getStatus() != EventStatus.CANCELLED) {
            throw new IllegalEventTransitionException(eventId, entity.getStatus().name(), EventStatus.CANCELLED.name());
        }

        long outstanding = ticketRepository.countByEventIdAndRefundedAtIsNull(eventId);
        if (outstanding > 0) {
            throw new CancellationIncompleteException(eventId, null, 0, (int) outstanding, null);
        }

        entity.resetRevenue();
        LiveEvent cancelled = entity.toDomain();
        outboxService.saveEvent(LiveEventFact.AGGREGATE_TYPE, eventId,
                EventStatusChangedFact.CANCELLATION_COMPLETED, EventStatusChangedFact.cancellationCompleted(cancelled));
        broadcasts.cancelled(cancelled);
        return cancelled;
    }

    @Transactional(readOnly = true)
    public LiveEvent getEvent(UUID eventId) {
        return eventRepository.findById(eventId)
            .map(LiveEventEntity::toDomain)
            .orElseThrow(() -> new EventNotFoundException(eventId));
    }

    /**
     * Newest first, at most {@value #MAX_LIST_SIZE}.
     */
    @Transactional(readOnly = true)
    public List<LiveEvent> listEvents(EventStatus status) {
        PageRequest page = PageRequest.of(0, MAX_LIST_SIZE);
        List<LiveEventEntity> events = status == null
            ? eventRepository.findAllByOrderByScheduledStartAtDesc(page)
            : eventRepository.findByStatusOrderByScheduledStartAtDesc(status, page);
        return events.stream().map(LiveEventEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<LiveEvent> getCreatorEvents(UUID creatorId, EventStatus status) {
        List<LiveEventEntity> events = status == null
            ? eventRepository.findByCreatorIdOrderByScheduledStartAtDesc(creatorId)
            : eventRepository.findByCreatorIdAndStatusOrderByScheduledStartAtDesc(creatorId, status);
        return events.stream().map(LiveEventEntity::toDomain).toList();
    }

    /**
     * Scheduled events that have not started yet, soonest first.
     */
    @Transactional(readOnly = true)
    public List<LiveEvent> getUpcomingEvents(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_LIST_SIZE));
        return eventRepository.findUpcoming(EventStatus.SCHEDULED, Instant.now(), PageRequest.of(0, size))
            .stream()
            .map(LiveEventEntity::toDomain)
            .toList();
    }

    /**
     * Live events, most watched first.
     */
    @Transactional(readOnly = true)
    public List<LiveEvent> getLiveEvents() {
        return eventRepository.findByStatusOrderByPeakConcurrentViewersDesc(EventStatus.LIVE)
            .stream()
            .map(LiveEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<EventTip> getEventTips(UUID eventId, int limit) {
        requireExists(eventId);
        int size = Math.max(1, Math.min(limit, MAX_LIST_SIZE));
        return tipRepository.findByEventIdOrderByTippedAtDesc(eventId, PageRequest.of(0, size))
            .stream()
            .map(EventTipEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public EventStats getEventStats(UUID eventId) {
        LiveEvent event = getEvent(eventId);
        return new EventStats(
            event,
            ticketRepository.countByEventId(eventId),
            tipRepository.countByEventId(eventId),
            tipRepository.sumAmountByEventId(eventId),
            attendanceRepository.countByEventIdAndActiveTrue(eventId)
        );
    }

    private LiveEventEntity lockOwnedEvent(UUID eventId, UUID userId) {
        LiveEventEntity entity = eventRepository.findByIdForUpdate(eventId)
            .orElseThrow(() -> new EventNotFoundException(eventId));
        if (!entity.getCreatorId().equals(userId)) {
            throw new NotEventCreatorException(eventId, userId);
        }
        return entity;
    }

    private void requireExists(UUID eventId) {
        if (!eventRepository.existsById(eventId)) {
            throw new EventNotFoundException(eventId);
        }
    }

    private int closeAttendance(UUID eventId, Instant leftAt) {
        List<EventAttendanceEntity> open = attendanceRepository.findByEventIdAndActiveTrue(eventId);
        open.forEach(attendance -> attendance.close(leftAt));
        return open.size();
    }

    private void recordTransition(EventStatus previous, LiveEvent event) {
        outboxService.saveEvent(LiveEventFact.AGGREGATE_TYPE, event.getId(),
                EventStatusChangedFact.EVENT_TYPE, EventStatusChangedFact.of(previous, event));
    }
}
