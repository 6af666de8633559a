package com.flagship.live_event_ledger.realtime;

import com.flagship.live_event_ledger.observability.CorrelationContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RealtimeBroadcastListenerTest {

    @Mock
    private RealtimeBroadcaster broadcaster;

    @InjectMocks
    private RealtimeBroadcastListener listener;

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Committed broadcast is forwarded with the request's correlation ID")
    void testOnBroadcastRequested_AttachesCorrelationId() {
        UUID eventId = UUID.randomUUID();
        RealtimeMessage message = RealtimeMessage.streamUpdate(RealtimeMessage.Payload.builder()
            .eventId(eventId)
            .status("live")
            .build());
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, "corr-123");

        listener.onBroadcastRequested(new RealtimeBroadcastRequested(RealtimeRooms.forEvent(eventId), message));

        ArgumentCaptor<RealtimeMessage> captor = ArgumentCaptor.forClass(RealtimeMessage.class);
        verify(broadcaster).broadcast(eq("event:" + eventId), captor.capture());
        assertEquals("corr-123", captor.getValue().getCorrelationId());
        assertEquals(RealtimeMessage.TYPE_STREAM_UPDATE, captor.getValue().getType());
        assertEquals("live", captor.getValue().getData().getStatus());
    }

    @Test
    @DisplayName("Broadcaster failure does not propagate")
    void testOnBroadcastRequested_FailureIsContained() {
        doThrow(new IllegalStateException("broker unavailable"))
            .when(broadcaster).broadcast(any(), any());
        RealtimeMessage message = RealtimeMessage.tip(RealtimeMessage.Payload.builder()
            .amountCents(500L)
            .build());

        assertDoesNotThrow(() -> listener.onBroadcastRequested(
            new RealtimeBroadcastRequested("event:" + UUID.randomUUID(), message)));
    }
}
