package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.event.notification.LiveEventFact;
import com.flagship.live_event_ledger.event.notification.TicketPurchasedFact;
import com.flagship.live_event_ledger.exception.DuplicateTicketException;
import com.flagship.live_event_ledger.exception.EventNotPurchasableException;
import com.flagship.live_event_ledger.exception.InsufficientFundsException;
import com.flagship.live_event_ledger.exception.InvalidTransferException;
import com.flagship.live_event_ledger.exception.SoldOutException;
import com.flagship.live_event_ledger.ledger.LedgerEntry;
import com.flagship.live_event_ledger.ledger.LedgerService;
import com.flagship.live_event_ledger.ledger.ReferenceType;
import com.flagship.live_event_ledger.outbox.OutboxEvent;
import com.flagship.live_event_ledger.outbox.OutboxService;
import com.flagship.live_event_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class TicketServiceIntegrationTest extends IntegrationTestSupport {

    private static final long PRICE = 5_000;

    @Autowired
    private TicketService ticketService;

    @Autowired
    private LiveEventService liveEventService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    @Test
    @DisplayName("Purchase pays the creator, records revenue and writes the outbox fact")
    void testPurchaseTicket_Success() {
        printTestHeader("Ticket purchase");

        // GIVEN
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(20_000);
        LiveEvent event = ticketedEvent(creator, null);
        printInput("Event", event.getId());

        // WHEN
        EventTicket ticket = ticketService.purchaseTicket(event.getId(), fan, PRICE);
        printOutput("Ticket", ticket.getId());

        // THEN
        assertEquals(15_000, availableBalance(fan));
        assertEquals(PRICE, availableBalance(creator));
        assertFalse(ticket.isRefunded());
        assertEquals(PRICE, ticket.getPricePaidCents());

        List<LedgerEntry> entries = ledgerService.getEntriesForTransaction(ticket.getTransactionId());
        assertEquals(2, entries.size());
        assertTrue(entries.stream().allMatch(e -> e.getReferenceType() == ReferenceType.EVENT_TICKET
            && ticket.getId().equals(e.getReferenceId())));
        assertEquals(event.getId(), entries.get(0).getMetadata().getEventId());

        LiveEvent updated = liveEventService.getEvent(event.getId());
        assertEquals(PRICE, updated.getTotalRevenueCents());

        List<OutboxEvent> facts = outboxService.getEventsForAggregate(LiveEventFact.AGGREGATE_TYPE, event.getId());
        assertTrue(facts.stream().anyMatch(f -> TicketPurchasedFact.EVENT_TYPE.equals(f.getEventType())));

        assertTrue(ticketService.findTicket(event.getId(), fan).isPresent());
        printSuccess("Ticket, ledger, revenue and outbox consistent");
    }

    @Test
    @DisplayName("Second purchase by the same fan is rejected without charging")
    void testPurchaseTicket_Duplicate() {
        // GIVEN
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(20_000);
        LiveEvent event = ticketedEvent(creator, null);
        ticketService.purchaseTicket(event.getId(), fan, PRICE);

        // WHEN / THEN
        assertThrows(DuplicateTicketException.class, () -> ticketService.purchaseTicket(event.getId(), fan, PRICE));
        assertEquals(15_000, availableBalance(fan));
        assertEquals(PRICE, liveEventService.getEvent(event.getId()).getTotalRevenueCents());
    }

    @Test
    @DisplayName("Price other than the event's price is rejected")
    void testPurchaseTicket_WrongPrice() {
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(20_000);
        LiveEvent event = ticketedEvent(creator, null);

        assertThrows(InvalidTransferException.class, () -> ticketService.purchaseTicket(event.getId(), fan, 1));
        assertEquals(20_000, availableBalance(fan));
    }

    @Test
    @DisplayName("Free and ended events do not sell tickets")
    void testPurchaseTicket_NotPurchasable() {
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(20_000);

        LiveEvent free = liveEventService.createEvent(creator, "Free show", null, AccessType.FREE,
            null, null, Instant.now().plus(1, ChronoUnit.DAYS));
        assertThrows(EventNotPurchasableException.class, () -> ticketService.purchaseTicket(free.getId(), fan, PRICE));

        LiveEvent ended = ticketedEvent(creator, null);
        liveEventService.startEvent(ended.getId(), creator);
        liveEventService.endEvent(ended.getId(), creator);
        assertThrows(EventNotPurchasableException.class, () -> ticketService.purchaseTicket(ended.getId(), fan, PRICE));

        assertEquals(20_000, availableBalance(fan));
    }

    @Test
    @DisplayName("Fan who cannot cover the price gets no ticket")
    void testPurchaseTicket_InsufficientFunds() {
        UUID creator = fundedUser(0);
        UUID fan = fundedUser(PRICE - 1);
        LiveEvent event = ticketedEvent(creator, null);

        assertThrows(InsufficientFundsException.class, () -> ticketService.purchaseTicket(event.getId(), fan, PRICE));

        assertTrue(ticketService.findTicket(event.getId(), fan).isEmpty());
        assertEquals(0, liveEventService.getEvent(event.getId()).getTotalRevenueCents());
        assertEquals(0, ledgerEntryCount(fan));
    }

    @Test
    @DisplayName("Two fans racing for the last seat: exactly one wins")
    void testPurchaseTicket_ConcurrentLastSeat() throws Exception {
        printTestHeader("Race for the last seat");

        // GIVEN
        UUID creator = fundedUser(0);
        UUID fanA = fundedUser(20_000);
        UUID fanB = fundedUser(20_000);
        LiveEvent event = ticketedEvent(creator, 1);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);

        // WHEN
        Future<Boolean> a = executor.submit(buyer(start, event.getId(), fanA));
        Future<Boolean> b = executor.submit(buyer(start, event.getId(), fanB));
        start.countDown();
        boolean aWon = a.get(30, TimeUnit.SECONDS);
        boolean bWon = b.get(30, TimeUnit.SECONDS);
        executor.shutdown();
        printOutput("Fan A won", aWon);
        printOutput("Fan B won", bWon);

        // THEN
        assertTrue(aWon ^ bWon, "Exactly one purchase must succeed");
        assertEquals(PRICE, availableBalance(creator));
        assertEquals(35_000, availableBalance(fanA) + availableBalance(fanB));
        assertEquals(PRICE, liveEventService.getEvent(event.getId()).getTotalRevenueCents());

        printSuccess("Capacity held under contention");
    }

    private Callable<Boolean> buyer(CountDownLatch start, UUID eventId, UUID fanId) {
        return () -> {
            start.await();
            try {
                ticketService.purchaseTicket(eventId, fanId, PRICE);
                return true;
            } catch (SoldOutException e) {
                return false;
            }
        };
    }

    private LiveEvent ticketedEvent(UUID creator, Integer maxAttendees) {
        return liveEventService.createEvent(creator, "Ticketed show", "test", AccessType.TICKETED,
            PRICE, maxAttendees, Instant.now().plus(1, ChronoUnit.DAYS));
    }
}
