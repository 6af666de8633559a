package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.entitlement.EntitlementService;
import com.flagship.live_event_ledger.exception.EventAccessDeniedException;
import com.flagship.live_event_ledger.exception.EventNotFoundException;
import com.flagship.live_event_ledger.exception.EventNotLiveException;
import com.flagship.live_event_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Joining and leaving live events.
 *
 * Join holds the event row lock so the viewer count and peak it records
 * are consistent with concurrent joins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttendanceService {

    private final LiveEventRepository eventRepository;
    private final EventTicketRepository ticketRepository;
    private final EventAttendanceRepository attendanceRepository;
    private final EntitlementService entitlementService;
    private final EventBroadcasts broadcasts;

    /**
     * Opens an attendance, or returns the user's open one unchanged.
     *
     * @throws EventNotLiveException if the event is not LIVE
     * @throws EventAccessDeniedException if the user may not watch the event
     */
    @Transactional
    public EventAttendance joinEvent(UUID eventId, UUID userId) {
        CorrelationContext.putOperation(eventId, userId);
        try {
            LiveEventEntity event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
            if (event.getStatus() != EventStatus.LIVE) {
                throw new EventNotLiveException(eventId, event.getStatus().name());
            }
            checkAccess(event, userId);

            Optional<EventAttendanceEntity> existing = attendanceRepository.findByEventIdAndUserIdAndActiveTrue(eventId, userId);
            if (existing.isPresent()) {
                log.debug("User already attending event {}", eventId);
                return existing.get().toDomain();
            }

            EventAttendanceEntity attendance = attendanceRepository.saveAndFlush(EventAttendanceEntity.open(eventId, userId));
            long activeViewers = attendanceRepository.countByEventIdAndActiveTrue(eventId);
            event.recordJoin(activeViewers);

            broadcasts.userJoined(eventId, userId, activeViewers);
            log.info("User joined event: activeViewers={}", activeViewers);
            return attendance.toDomain();

        } catch (EventAccessDeniedException | EventNotLiveException e) {
            log.warn("Join rejected: reason={}", e.getMessage());
            throw e;
        } finally {
            CorrelationContext.clearOperation();
        }
    }

    /**
     * Closes the user's open attendance. Leaving without one does nothing.
     */
    @Transactional
    public Optional<EventAttendance> leaveEvent(UUID eventId, UUID userId) {
        if (!eventRepository.existsById(eventId)) {
            throw new EventNotFoundException(eventId);
        }

        Optional<EventAttendanceEntity> open = attendanceRepository.findByEventIdAndUserIdAndActiveTrue(eventId, userId);
        if (open.isEmpty()) {
            return Optional.empty();
        }

        EventAttendanceEntity attendance = open.get();
        attendance.close(Instant.now());
        attendanceRepository.saveAndFlush(attendance);

        long activeViewers = attendanceRepository.countByEventIdAndActiveTrue(eventId);
        broadcasts.userLeft(eventId, userId, activeViewers);
        log.info("User left event {}: durationSeconds={}, activeViewers={}",
                eventId, attendance.getDurationSeconds(), activeViewers);
        return Optional.of(attendance.toDomain());
    }

    @Transactional(readOnly = true)
    public List<EventAttendance> getActiveAttendees(UUID eventId) {
        if (!eventRepository.existsById(eventId)) {
            throw new EventNotFoundException(eventId);
        }
        return attendanceRepository.findByEventIdAndActiveTrue(eventId)
            .stream()
            .map(EventAttendanceEntity::toDomain)
            .toList();
    }

    private void checkAccess(LiveEventEntity event, UUID userId) {
        if (event.getCreatorId().equals(userId)) {
            return;
        }
        AccessType accessType = event.getAccessType();
        if (accessType == AccessType.TICKETED
                && !ticketRepository.existsByEventIdAndFanIdAndRefundedAtIsNull(event.getId(), userId)) {
            throw new EventAccessDeniedException(event.getId(), userId, "a ticket is required");
        }
        if (accessType.requiresEntitlement() && !entitlementService.hasEntitlement(userId, event.getId())) {
            throw new EventAccessDeniedException(event.getId(), userId,
                    accessType == AccessType.SUBSCRIPTION_ONLY ? "a subscription is required" : "a higher tier is required");
        }
    }
}
