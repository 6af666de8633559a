package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.config.JacksonConfig;
import com.flagship.live_event_ledger.exception.EventNotLiveException;
import com.flagship.live_event_ledger.exception.IdempotencyConflictException;
import com.flagship.live_event_ledger.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TipControllerTest {

    @Mock
    private TipService tipService;

    @Mock
    private LiveEventService liveEventService;

    private MockMvc mockMvc;

    private final UUID eventId = UUID.randomUUID();
    private final UUID fanId = UUID.randomUUID();
    private final UUID creatorId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TipController(tipService, liveEventService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(JacksonConfig.createObjectMapper()))
            .build();
    }

    @Test
    @DisplayName("New tip returns 201")
    void testSendTip_Created() throws Exception {
        when(tipService.sendTip(eq(eventId), eq(fanId), isNull(), eq(500L), eq("nice set"), eq(false), eq("key-1")))
            .thenReturn(new TipOutcome(tip(false), false));

        mockMvc.perform(post("/api/events/{eventId}/tips", eventId)
                .header(UserHeaders.USER_ID, fanId.toString())
                .header(UserHeaders.IDEMPOTENCY_KEY, "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount_cents\": 500, \"message\": \"nice set\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.amount_cents").value(500))
            .andExpect(jsonPath("$.from_user_id").value(fanId.toString()));
    }

    @Test
    @DisplayName("Replayed idempotency key returns 200 with the original tip")
    void testSendTip_ReplayReturnsOk() throws Exception {
        when(tipService.sendTip(eq(eventId), eq(fanId), isNull(), eq(500L), isNull(), eq(false), eq("key-1")))
            .thenReturn(new TipOutcome(tip(false), true));

        mockMvc.perform(post("/api/events/{eventId}/tips", eventId)
                .header(UserHeaders.USER_ID, fanId.toString())
                .header(UserHeaders.IDEMPOTENCY_KEY, "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount_cents\": 500}"))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Anonymous tip hides the sender")
    void testSendTip_AnonymousHidesSender() throws Exception {
        when(tipService.sendTip(eq(eventId), eq(fanId), isNull(), eq(500L), isNull(), eq(true), isNull()))
            .thenReturn(new TipOutcome(tip(true), false));

        mockMvc.perform(post("/api/events/{eventId}/tips", eventId)
                .header(UserHeaders.USER_ID, fanId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount_cents\": 500, \"anonymous\": true}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.anonymous").value(true))
            .andExpect(jsonPath("$.from_user_id").doesNotExist());
    }

    @Test
    @DisplayName("Missing user header is rejected before the service is called")
    void testSendTip_MissingUserHeader() throws Exception {
        mockMvc.perform(post("/api/events/{eventId}/tips", eventId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount_cents\": 500}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(tipService);
    }

    @Test
    @DisplayName("Non-positive amount fails validation")
    void testSendTip_NegativeAmount() throws Exception {
        mockMvc.perform(post("/api/events/{eventId}/tips", eventId)
                .header(UserHeaders.USER_ID, fanId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount_cents\": -5}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.amountCents").exists());

        verifyNoInteractions(tipService);
    }

    @Test
    @DisplayName("Tip to an event that is not live maps to 422")
    void testSendTip_EventNotLive() throws Exception {
        when(tipService.sendTip(eq(eventId), eq(fanId), any(), anyLong(), any(), anyBoolean(), any()))
            .thenThrow(new EventNotLiveException(eventId, "SCHEDULED"));

        mockMvc.perform(post("/api/events/{eventId}/tips", eventId)
                .header(UserHeaders.USER_ID, fanId.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount_cents\": 500}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("EVENT_NOT_LIVE"));

        verify(tipService).sendTip(eq(eventId), eq(fanId), any(), anyLong(), any(), anyBoolean(), any());
    }

    private EventTip tip(boolean anonymous) {
        return new EventTip(UUID.randomUUID(), eventId, fanId, creatorId, 500L, "nice set",
            anonymous, UUID.randomUUID(), Instant.now());
    }

    @Test
    @DisplayName("Idempotency key reused for a different tip returns 409")
    void testSendTip_IdempotencyConflict() throws Exception {
        when(tipService.sendTip(eq(eventId), eq(fanId), any(), anyLong(), any(), anyBoolean(), eq("key-1")))
            .thenThrow(new IdempotencyConflictException("key-1", UUID.randomUUID()));

        mockMvc.perform(post("/api/events/{eventId}/tips", eventId)
                .header(UserHeaders.USER_ID, fanId.toString())
                .header(UserHeaders.IDEMPOTENCY_KEY, "key-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount_cents\": 9999}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("C002"))
            .andExpect(jsonPath("$.error").value("IDEMPOTENCY_CONFLICT"));
    }
}
