package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.event.notification.LiveEventFact;
import com.flagship.live_event_ledger.event.notification.TicketPurchasedFact;
import com.flagship.live_event_ledger.exception.DuplicateTicketException;
import com.flagship.live_event_ledger.exception.EventNotFoundException;
import com.flagship.live_event_ledger.exception.EventNotPurchasableException;
import com.flagship.live_event_ledger.exception.InvalidTransferException;
import com.flagship.live_event_ledger.exception.LedgerException;
import com.flagship.live_event_ledger.exception.SoldOutException;
import com.flagship.live_event_ledger.ledger.LedgerMetadata;
import com.flagship.live_event_ledger.ledger.ReferenceType;
import com.flagship.live_event_ledger.ledger.TransactionType;
import com.flagship.live_event_ledger.observability.CorrelationContext;
import com.flagship.live_event_ledger.observability.LedgerMetrics;
import com.flagship.live_event_ledger.outbox.OutboxService;
import com.flagship.live_event_ledger.transfer.TransferEngine;
import com.flagship.live_event_ledger.transfer.TransferRequest;
import com.flagship.live_event_ledger.transfer.TransferResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Ticket sales.
 *
 * Lock order is the event row (taken first, held by the capacity gate until
 * commit) and then both wallets through the transfer engine. A rejected
 * purchase leaves no ticket, no balance change and no ledger entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TicketService {

    private final LiveEventRepository eventRepository;
    private final EventTicketRepository ticketRepository;
    private final CapacityGate capacityGate;
    private final TransferEngine transferEngine;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @throws EventNotPurchasableException if the event is not ticketed or is over
     * @throws DuplicateTicketException if the fan already holds a ticket for the event
     * @throws SoldOutException if every seat is taken
     * @throws com.flagship.live_event_ledger.exception.InsufficientFundsException
     *         if the fan cannot cover the price
     */
    @Transactional
    public EventTicket purchaseTicket(UUID eventId, UUID fanId, long priceCents) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putOperation(eventId, fanId);

        try {
            LiveEventEntity eventEntity = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
            LiveEvent event = eventEntity.toDomain();

            if (event.getAccessType() != AccessType.TICKETED) {
                throw new EventNotPurchasableException(eventId, "event is " + event.getAccessType());
            }
            if (!event.acceptsTicketPurchase()) {
                throw new EventNotPurchasableException(eventId, "event is " + event.getStatus());
            }
            if (priceCents <= 0) {
                throw new InvalidTransferException("Ticket price must be positive, got " + priceCents);
            }
            if (event.getTicketPriceCents() != null && event.getTicketPriceCents() != priceCents) {
                throw new InvalidTransferException(String.format(
                    "Ticket price is %d cents, got %d", event.getTicketPriceCents(), priceCents));
            }
            if (ticketRepository.existsByEventIdAndFanId(eventId, fanId)) {
                throw new DuplicateTicketException(eventId, fanId);
            }
            if (capacityGate.reserveSlot(eventId) == SlotReservation.SOLD_OUT) {
                throw new SoldOutException(eventId, event.getMaxAttendees());
            }

            UUID ticketId = UUID.randomUUID();
            TransferResult payment = transferEngine.transfer(TransferRequest.builder()
                .fromUserId(fanId)
                .toUserId(event.getCreatorId())
                .amountCents(priceCents)
                .transactionType(TransactionType.PAYMENT)
                .referenceType(ReferenceType.EVENT_TICKET)
                .referenceId(ticketId)
                .debitDescription("Ticket for " + event.getTitle())
                .creditDescription("Ticket sale for " + event.getTitle())
                .metadata(LedgerMetadata.builder()
                    .eventId(eventId)
                    .eventTitle(event.getTitle())
                    .ticketId(ticketId)
                    .build())
                .build());

            EventTicket ticket = ticketRepository.save(
                    EventTicketEntity.create(ticketId, eventId, fanId, priceCents, payment.getTransactionId()))
                .toDomain();
            eventEntity.recordTicketSale(priceCents);

            outboxService.saveEvent(LiveEventFact.AGGREGATE_TYPE, eventId,
                    TicketPurchasedFact.EVENT_TYPE, TicketPurchasedFact.from(ticket));

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordTicketPurchase("success");
            ledgerMetrics.recordLatency("ticket_purchase", duration);
            log.info("Ticket purchased: ticketId={}, priceCents={}, duration={}ms", ticketId, priceCents, duration);

            return ticket;

        } catch (SoldOutException e) {
            ledgerMetrics.recordSoldOut();
            ledgerMetrics.recordTicketPurchase("sold_out");
            log.info("Ticket purchase rejected, sold out: capacity={}", e.getMaxAttendees());
            throw e;
        } catch (LedgerException e) {
            ledgerMetrics.recordTicketPurchase(e.getErrorCode().name().toLowerCase());
            log.warn("Ticket purchase rejected: reason={}", e.getMessage());
            throw e;
        } finally {
            CorrelationContext.clearOperation();
        }
    }

    @Transactional(readOnly = true)
    public Optional<EventTicket> findTicket(UUID eventId, UUID fanId) {
        return ticketRepository.findByEventIdAndFanId(eventId, fanId).map(EventTicketEntity::toDomain);
    }
}
