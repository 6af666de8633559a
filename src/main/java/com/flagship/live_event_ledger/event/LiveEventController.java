package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.event.dto.AttendanceResponse;
import com.flagship.live_event_ledger.event.dto.CreateEventRequest;
import com.flagship.live_event_ledger.event.dto.EventResponse;
import com.flagship.live_event_ledger.event.dto.EventStatsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Event lifecycle, attendance and read endpoints. The acting user is the
 * {@code X-User-Id} header.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
@Slf4j
public class LiveEventController {

    private final LiveEventService liveEventService;
    private final EventCancellationService cancellationService;
    private final AttendanceService attendanceService;

    @PostMapping
    public ResponseEntity<EventResponse> createEvent(
            @RequestHeader(UserHeaders.USER_ID) UUID creatorId,
            @Valid @RequestBody CreateEventRequest request) {
        LiveEvent event = liveEventService.createEvent(
            creatorId,
            request.getTitle(),
            request.getDescription(),
            request.getAccessType(),
            request.getTicketPriceCents(),
            request.getMaxAttendees(),
            request.getScheduledStartAt()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.from(event));
    }

    @GetMapping
    public ResponseEntity<List<EventResponse>> listEvents(
            @RequestParam(name = "status", required = false) String status) {
        return ResponseEntity.ok(toResponses(liveEventService.listEvents(parseStatus(status))));
    }

    @GetMapping("/upcoming")
    public ResponseEntity<List<EventResponse>> getUpcomingEvents(
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        return ResponseEntity.ok(toResponses(liveEventService.getUpcomingEvents(limit)));
    }

    @GetMapping("/live")
    public ResponseEntity<List<EventResponse>> getLiveEvents() {
        return ResponseEntity.ok(toResponses(liveEventService.getLiveEvents()));
    }

    @GetMapping("/creator/{creatorId}")
    public ResponseEntity<List<EventResponse>> getCreatorEvents(
            @PathVariable("creatorId") UUID creatorId,
            @RequestParam(name = "status", required = false) String status) {
        return ResponseEntity.ok(toResponses(liveEventService.getCreatorEvents(creatorId, parseStatus(status))));
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(EventResponse.from(liveEventService.getEvent(eventId)));
    }

    @GetMapping("/{eventId}/stats")
    public ResponseEntity<EventStatsResponse> getEventStats(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(EventStatsResponse.from(liveEventService.getEventStats(eventId)));
    }

    @PostMapping("/{eventId}/start")
    public ResponseEntity<EventResponse> startEvent(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(UserHeaders.USER_ID) UUID creatorId) {
        return ResponseEntity.ok(EventResponse.from(liveEventService.startEvent(eventId, creatorId)));
    }

    @PostMapping("/{eventId}/end")
    public ResponseEntity<EventResponse> endEvent(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(UserHeaders.USER_ID) UUID creatorId) {
        return ResponseEntity.ok(EventResponse.from(liveEventService.endEvent(eventId, creatorId)));
    }

    /**
     * Cancels the event and refunds every ticket. Safe to repeat: a repeated
     * call finishes any refunds an earlier call could not commit.
     */
    @PostMapping("/{eventId}/cancel")
    public ResponseEntity<EventResponse> cancelEvent(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(UserHeaders.USER_ID) UUID creatorId) {
        return ResponseEntity.ok(EventResponse.from(cancellationService.cancelEvent(eventId, creatorId)));
    }

    @PostMapping("/{eventId}/join")
    public ResponseEntity<AttendanceResponse> joinEvent(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(UserHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(AttendanceResponse.from(attendanceService.joinEvent(eventId, userId)));
    }

    @PostMapping("/{eventId}/leave")
    public ResponseEntity<AttendanceResponse> leaveEvent(
            @PathVariable("eventId") UUID eventId,
            @RequestHeader(UserHeaders.USER_ID) UUID userId) {
        return attendanceService.leaveEvent(eventId, userId)
            .map(attendance -> ResponseEntity.ok(AttendanceResponse.from(attendance)))
            .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping("/{eventId}/attendees")
    public ResponseEntity<List<AttendanceResponse>> getActiveAttendees(@PathVariable("eventId") UUID eventId) {
        List<AttendanceResponse> attendees = attendanceService.getActiveAttendees(eventId)
            .stream()
            .map(AttendanceResponse::from)
            .toList();
        return ResponseEntity.ok(attendees);
    }

    private static EventStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return EventStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event status: " + status);
        }
    }

    private static List<EventResponse> toResponses(List<LiveEvent> events) {
        return events.stream().map(EventResponse::from).toList();
    }
}
