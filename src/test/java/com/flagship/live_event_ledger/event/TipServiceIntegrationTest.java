package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.exception.EventNotLiveException;
import com.flagship.live_event_ledger.exception.IdempotencyConflictException;
import com.flagship.live_event_ledger.exception.InsufficientFundsException;
import com.flagship.live_event_ledger.exception.InvalidTransferException;
import com.flagship.live_event_ledger.ledger.LedgerEntry;
import com.flagship.live_event_ledger.ledger.LedgerService;
import com.flagship.live_event_ledger.realtime.RealtimeMessage;
import com.flagship.live_event_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Testcontainers(disabledWithoutDocker = true)
class TipServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private TipService tipService;

    @Autowired
    private LiveEventService liveEventService;

    @Autowired
    private LedgerService ledgerService;

    @Test
    @DisplayName("Tips are refused before the event goes live")
    void testSendTip_EventNotLive() {
        // GIVEN
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(1_000);
        LiveEvent event = freeEvent(creator);

        // WHEN / THEN
        assertThrows(EventNotLiveException.class,
            () -> tipService.sendTip(event.getId(), fan, null, 500, "hi", false, null));
        assertEquals(1_000, availableBalance(fan));
        verify(realtimeBroadcaster, never()).broadcast(anyString(), any());
    }

    @Test
    @DisplayName("Tip during a live event pays the creator and is broadcast")
    void testSendTip_Live() {
        printTestHeader("Live tip");

        // GIVEN
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(1_000);
        LiveEvent event = liveFreeEvent(creator);

        // WHEN
        TipOutcome outcome = tipService.sendTip(event.getId(), fan, null, 400, "great show", false, "tip-" + UUID.randomUUID());
        printOutput("Tip", outcome.getTip().getId());

        // THEN
        assertFalse(outcome.isReplayed());
        assertEquals(creator, outcome.getTip().getToUserId());
        assertEquals(600, availableBalance(fan));
        assertEquals(400, availableBalance(creator));

        LiveEvent updated = liveEventService.getEvent(event.getId());
        assertEquals(400, updated.getTotalTipsCents());
        assertEquals(400, updated.getTotalRevenueCents());

        List<LedgerEntry> entries = ledgerService.getEntriesForTransaction(outcome.getTip().getTransactionId());
        assertEquals(2, entries.size());
        assertEquals("great show", entries.get(0).getMetadata().getTipMessage());

        ArgumentCaptor<RealtimeMessage> message = ArgumentCaptor.forClass(RealtimeMessage.class);
        verify(realtimeBroadcaster).broadcast(eq("event:" + event.getId()), message.capture());
        assertEquals(RealtimeMessage.TYPE_TIP, message.getValue().getType());
        assertEquals(400L, message.getValue().getData().getAmountCents());
        assertEquals(fan, message.getValue().getData().getFromUserId());

        printSuccess("Tip settled and announced");
    }

    @Test
    @DisplayName("Anonymous tip is broadcast without the sender")
    void testSendTip_Anonymous() {
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(1_000);
        LiveEvent event = liveFreeEvent(creator);

        tipService.sendTip(event.getId(), fan, creator, 100, null, true, null);

        ArgumentCaptor<RealtimeMessage> message = ArgumentCaptor.forClass(RealtimeMessage.class);
        verify(realtimeBroadcaster).broadcast(eq("event:" + event.getId()), message.capture());
        assertNull(message.getValue().getData().getFromUserId());
        assertTrue(message.getValue().getData().getAnonymous());
    }

    @Test
    @DisplayName("Same idempotency key moves money once")
    void testSendTip_IdempotentReplay() {
        printTestHeader("Tip replay");

        // GIVEN
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(1_000);
        LiveEvent event = liveFreeEvent(creator);
        String key = "tip-" + UUID.randomUUID();

        // WHEN
        TipOutcome first = tipService.sendTip(event.getId(), fan, null, 300, null, false, key);
        TipOutcome second = tipService.sendTip(event.getId(), fan, null, 300, null, false, key);

        // THEN
        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getTip().getId(), second.getTip().getId());
        assertEquals(700, availableBalance(fan));
        assertEquals(300, liveEventService.getEvent(event.getId()).getTotalTipsCents());
        assertEquals(1, ledgerEntryCount(fan));
        assertEquals(1, ledgerEntryCount(creator));

        printSuccess("Replay returned the original tip");
    }

    @Test
    @DisplayName("Replay still works with Redis down")
    void testSendTip_RedisDown() {
        // GIVEN
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("redis down"));
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(1_000);
        LiveEvent event = liveFreeEvent(creator);
        String key = "tip-" + UUID.randomUUID();

        // WHEN
        tipService.sendTip(event.getId(), fan, null, 250, null, false, key);
        TipOutcome replay = tipService.sendTip(event.getId(), fan, null, 250, null, false, key);

        // THEN
        assertTrue(replay.isReplayed());
        assertEquals(750, availableBalance(fan));
    }

    @Test
    @DisplayName("Tip to a co-host is paid to the co-host")
    void testSendTip_ToCoHost() {
        printTestHeader("Co-host tip");

        // GIVEN
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(1_000);
        UUID coHost = fundedUser(0);
        LiveEvent event = liveFreeEvent(creator);

        // WHEN
        TipOutcome outcome = tipService.sendTip(event.getId(), fan, coHost, 100, null, false, null);

        // THEN
        assertEquals(coHost, outcome.getTip().getToUserId());
        assertEquals(100, availableBalance(coHost));
        assertEquals(0, availableBalance(creator));
        assertEquals(900, availableBalance(fan));
        assertEquals(100, liveEventService.getEvent(event.getId()).getTotalTipsCents());

        printSuccess("Co-host received the tip");
    }

    @Test
    @DisplayName("Tip to yourself is refused")
    void testSendTip_ToSelf() {
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(1_000);
        LiveEvent event = liveFreeEvent(creator);

        assertThrows(InvalidTransferException.class,
            () -> tipService.sendTip(event.getId(), fan, fan, 100, null, false, null));
        assertEquals(1_000, availableBalance(fan));
    }

    @Test
    @DisplayName("Idempotency key reused on another event is a conflict and moves no money")
    void testSendTip_KeyReusedOnOtherEvent() {
        printTestHeader("Key reused on another event");

        // GIVEN
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(20_000);
        LiveEvent first = liveFreeEvent(creator);
        LiveEvent second = liveFreeEvent(creator);
        String key = "tip-" + UUID.randomUUID();
        tipService.sendTip(first.getId(), fan, null, 100, null, false, key);

        // WHEN / THEN
        assertThrows(IdempotencyConflictException.class,
            () -> tipService.sendTip(second.getId(), fan, null, 9_999, null, false, key));
        assertEquals(19_900, availableBalance(fan));
        assertEquals(0, liveEventService.getEvent(second.getId()).getTotalTipsCents());

        printSuccess("Conflicting reuse rejected");
    }

    @Test
    @DisplayName("Idempotency key reused with a different amount is a conflict")
    void testSendTip_KeyReusedWithOtherAmount() {
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(1_000);
        LiveEvent event = liveFreeEvent(creator);
        String key = "tip-" + UUID.randomUUID();
        tipService.sendTip(event.getId(), fan, null, 100, null, false, key);

        assertThrows(IdempotencyConflictException.class,
            () -> tipService.sendTip(event.getId(), fan, null, 200, null, false, key));
        assertEquals(900, availableBalance(fan));
    }

    @Test
    @DisplayName("Another sender using the same key sends a tip of their own")
    void testSendTip_SameKeyOtherSender() {
        printTestHeader("Same key, other sender");

        // GIVEN
        UUID creator = fundedUser(0);
        UUID alice = fundedUser(1_000);
        UUID bob = fundedUser(20_000);
        LiveEvent aliceEvent = liveFreeEvent(creator);
        LiveEvent bobEvent = liveFreeEvent(creator);
        String key = "tip-" + UUID.randomUUID();
        TipOutcome aliceTip = tipService.sendTip(aliceEvent.getId(), alice, null, 100, null, false, key);

        // WHEN
        TipOutcome bobTip = tipService.sendTip(bobEvent.getId(), bob, null, 9_999, null, false, key);
        printOutput("Bob's tip", bobTip.getTip().getId());

        // THEN
        assertFalse(bobTip.isReplayed());
        assertNotEquals(aliceTip.getTip().getId(), bobTip.getTip().getId());
        assertEquals(bob, bobTip.getTip().getFromUserId());
        assertEquals(bobEvent.getId(), bobTip.getTip().getEventId());
        assertEquals(10_001, availableBalance(bob));
        assertEquals(900, availableBalance(alice));

        printSuccess("Keys are scoped to their sender");
    }

    @Test
    @DisplayName("Tip larger than the balance is refused and nothing is recorded")
    void testSendTip_InsufficientFunds() {
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(100);
        LiveEvent event = liveFreeEvent(creator);

        assertThrows(InsufficientFundsException.class,
            () -> tipService.sendTip(event.getId(), fan, null, 500, null, false, "tip-" + UUID.randomUUID()));

        assertEquals(0, liveEventService.getEvent(event.getId()).getTotalTipsCents());
        assertTrue(liveEventService.getEventTips(event.getId(), 10).isEmpty());
        verify(realtimeBroadcaster, never()).broadcast(anyString(), any());
    }

    private LiveEvent freeEvent(UUID creator) {
        return liveEventService.createEvent(creator, "Tip jar", null, AccessType.FREE,
            null, null, Instant.now().plus(1, ChronoUnit.HOURS));
    }

    private LiveEvent liveFreeEvent(UUID creator) {
        LiveEvent event = freeEvent(creator);
        LiveEvent live = liveEventService.startEvent(event.getId(), creator);
        clearInvocations(realtimeBroadcaster);
        return live;
    }
}
