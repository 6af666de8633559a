package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.exception.EventAccessDeniedException;
import com.flagship.live_event_ledger.exception.EventNotLiveException;
import com.flagship.live_event_ledger.realtime.RealtimeMessage;
import com.flagship.live_event_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Testcontainers(disabledWithoutDocker = true)
class AttendanceServiceIntegrationTest extends IntegrationTestSupport {

    private static final long PRICE = 1_500;

    @Autowired
    private AttendanceService attendanceService;

    @Autowired
    private LiveEventService liveEventService;

    @Autowired
    private TicketService ticketService;

    @Test
    @DisplayName("Joining before the event starts is refused")
    void testJoinEvent_NotLive() {
        UUID creator = UUID.randomUUID();
        LiveEvent event = createEvent(creator, AccessType.FREE);

        assertThrows(EventNotLiveException.class, () -> attendanceService.joinEvent(event.getId(), UUID.randomUUID()));
    }

    @Test
    @DisplayName("Ticketed event admits ticket holders only")
    void testJoinEvent_TicketRequired() {
        printTestHeader("Ticketed join");

        // GIVEN
        UUID creator = fundedUser(0);
        UUID holder = fundedUser(PRICE);
        UUID stranger = UUID.randomUUID();
        LiveEvent event = createEvent(creator, AccessType.TICKETED);
        ticketService.purchaseTicket(event.getId(), holder, PRICE);
        start(event, creator);

        // WHEN / THEN
        assertThrows(EventAccessDeniedException.class, () -> attendanceService.joinEvent(event.getId(), stranger));
        EventAttendance attendance = attendanceService.joinEvent(event.getId(), holder);
        printOutput("Attendance", attendance.getId());

        assertTrue(attendance.isActive());
        assertEquals(holder, attendance.getUserId());

        printSuccess("Ticket gate enforced");
    }

    @Test
    @DisplayName("Creator always gets in, gated events need an entitlement")
    void testJoinEvent_EntitlementDeniedByDefault() {
        UUID creator = UUID.randomUUID();
        LiveEvent event = createEvent(creator, AccessType.SUBSCRIPTION_ONLY);
        start(event, creator);

        assertThrows(EventAccessDeniedException.class,
            () -> attendanceService.joinEvent(event.getId(), UUID.randomUUID()));
        assertTrue(attendanceService.joinEvent(event.getId(), creator).isActive());
    }

    @Test
    @DisplayName("Joining twice keeps one open attendance")
    void testJoinEvent_Idempotent() {
        UUID creator = UUID.randomUUID();
        UUID viewer = UUID.randomUUID();
        LiveEvent event = createEvent(creator, AccessType.FREE);
        start(event, creator);

        EventAttendance first = attendanceService.joinEvent(event.getId(), viewer);
        EventAttendance second = attendanceService.joinEvent(event.getId(), viewer);

        assertEquals(first.getId(), second.getId());
        assertEquals(1, attendanceService.getActiveAttendees(event.getId()).size());
        assertEquals(1, liveEventService.getEvent(event.getId()).getTotalAttendees());
        verify(realtimeBroadcaster, times(1)).broadcast(eq("event:" + event.getId()),
            any(RealtimeMessage.class));
    }

    @Test
    @DisplayName("Peak viewers tracks the highest concurrent count")
    void testJoinEvent_PeakViewers() {
        printTestHeader("Peak viewers");

        // GIVEN
        UUID creator = UUID.randomUUID();
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        UUID c = UUID.randomUUID();
        LiveEvent event = createEvent(creator, AccessType.FREE);
        start(event, creator);

        // WHEN
        attendanceService.joinEvent(event.getId(), a);
        attendanceService.joinEvent(event.getId(), b);
        attendanceService.leaveEvent(event.getId(), a);
        attendanceService.joinEvent(event.getId(), c);

        // THEN
        LiveEvent updated = liveEventService.getEvent(event.getId());
        printOutput("Peak", updated.getPeakConcurrentViewers());
        assertEquals(2, updated.getPeakConcurrentViewers());
        assertEquals(3, updated.getTotalAttendees());
        assertEquals(2, attendanceService.getActiveAttendees(event.getId()).size());

        printSuccess("Peak kept at 2");
    }

    @Test
    @DisplayName("Leaving closes the attendance and tells the room")
    void testLeaveEvent_ClosesAttendance() {
        // GIVEN
        UUID creator = UUID.randomUUID();
        UUID viewer = UUID.randomUUID();
        LiveEvent event = createEvent(creator, AccessType.FREE);
        start(event, creator);
        attendanceService.joinEvent(event.getId(), viewer);
        clearInvocations(realtimeBroadcaster);

        // WHEN
        Optional<EventAttendance> left = attendanceService.leaveEvent(event.getId(), viewer);

        // THEN
        assertTrue(left.isPresent());
        assertFalse(left.get().isActive());
        assertNotNull(left.get().getLeftAt());
        assertNotNull(left.get().getDurationSeconds());
        assertTrue(attendanceService.getActiveAttendees(event.getId()).isEmpty());

        ArgumentCaptor<RealtimeMessage> message = ArgumentCaptor.forClass(RealtimeMessage.class);
        verify(realtimeBroadcaster).broadcast(eq("event:" + event.getId()), message.capture());
        assertEquals("user_left", message.getValue().getData().getAction());
        assertEquals(0L, message.getValue().getData().getCurrentViewers());

        assertTrue(attendanceService.leaveEvent(event.getId(), viewer).isEmpty());
    }

    @Test
    @DisplayName("Ending the event closes open attendance")
    void testEndEvent_ClosesAttendance() {
        UUID creator = UUID.randomUUID();
        LiveEvent event = createEvent(creator, AccessType.FREE);
        start(event, creator);
        attendanceService.joinEvent(event.getId(), UUID.randomUUID());
        attendanceService.joinEvent(event.getId(), UUID.randomUUID());

        liveEventService.endEvent(event.getId(), creator);

        assertTrue(attendanceService.getActiveAttendees(event.getId()).isEmpty());
    }

    private LiveEvent createEvent(UUID creator, AccessType accessType) {
        return liveEventService.createEvent(creator, "Attendance test", null, accessType,
            accessType == AccessType.TICKETED ? PRICE : null, null, Instant.now().plus(2, ChronoUnit.HOURS));
    }

    private void start(LiveEvent event, UUID creator) {
        liveEventService.startEvent(event.getId(), creator);
        clearInvocations(realtimeBroadcaster);
    }
}
