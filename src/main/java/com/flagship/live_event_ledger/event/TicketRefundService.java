package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.event.notification.LiveEventFact;
import com.flagship.live_event_ledger.event.notification.TicketRefundedFact;
import com.flagship.live_event_ledger.exception.EventClosedException;
import com.flagship.live_event_ledger.exception.EventNotFoundException;
import com.flagship.live_event_ledger.exception.IntegrityException;
import com.flagship.live_event_ledger.exception.LedgerException;
import com.flagship.live_event_ledger.exception.NotEventCreatorException;
import com.flagship.live_event_ledger.exception.TicketNotFoundException;
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
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Returns a ticket's price from the creator to the fan.
 *
 * Idempotent per ticket: a ticket that already carries a refund is skipped
 * and no money moves. Locks are taken event, ticket, then wallets.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TicketRefundService {

    static final String REASON_CANCELLED = "event_cancelled";
    static final String REASON_CREATOR = "creator_refund";

    private final LiveEventRepository eventRepository;
    private final EventTicketRepository ticketRepository;
    private final TransferEngine transferEngine;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Refunds one ticket of a cancelled event in its own transaction, so a
     * committed refund survives a later failure in the cascade.
     *
     * @return true if money moved, false if the ticket was already refunded
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean refundForCancellation(UUID eventId, UUID ticketId) {
        LiveEventEntity event = eventRepository.findByIdForUpdate(eventId)
            .orElseThrow(() -> new EventNotFoundException(eventId));
        if (event.getStatus() != EventStatus.CANCELLED) {
            throw new IntegrityException(String.format(
                "Cancellation refund for ticket %s but event %s is %s", ticketId, eventId, event.getStatus()));
        }

        EventTicketEntity ticket = ticketRepository.findByIdForUpdate(ticketId)
            .orElseThrow(() -> new TicketNotFoundException(ticketId));
        return refund(event, ticket, REASON_CANCELLED);
    }

    /**
     * Creator-initiated refund of a single ticket. Revenue drops by the price.
     * Refunding an already refunded ticket returns it unchanged.
     *
     * An ended event moves no more money. On a cancelled event the ticket is
     * refunded the way the cancellation cascade would, leaving revenue to the
     * cascade.
     *
     * @throws EventClosedException if the event has ended
     */
    @Transactional
    public EventTicket refundTicket(UUID ticketId, UUID creatorId) {
        long startTime = System.currentTimeMillis();
        UUID eventId = ticketRepository.findEventIdById(ticketId)
            .orElseThrow(() -> new TicketNotFoundException(ticketId));
        CorrelationContext.putOperation(eventId, creatorId);

        try {
            LiveEventEntity event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
            if (!event.getCreatorId().equals(creatorId)) {
                throw new NotEventCreatorException(eventId, creatorId);
            }

            if (event.getStatus() == EventStatus.ENDED) {
                throw new EventClosedException(eventId, event.getStatus().name());
            }

            EventTicketEntity ticket = ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(() -> new TicketNotFoundException(ticketId));
            if (event.getStatus() == EventStatus.CANCELLED) {
                refund(event, ticket, REASON_CANCELLED);
                return ticket.toDomain();
            }
            if (refund(event, ticket, REASON_CREATOR)) {
                event.recordTicketRefund(ticket.getPricePaidCents());
                log.info("Ticket refunded by creator: ticketId={}, amountCents={}, duration={}ms",
                        ticketId, ticket.getPricePaidCents(), System.currentTimeMillis() - startTime);
            }
            return ticket.toDomain();

        } catch (LedgerException e) {
            log.warn("Ticket refund rejected: ticketId={}, reason={}", ticketId, e.getMessage());
            throw e;
        } finally {
            CorrelationContext.clearOperation();
        }
    }

    private boolean refund(LiveEventEntity event, EventTicketEntity ticket, String reason) {
        if (!ticket.getEventId().equals(event.getId())) {
            throw new IntegrityException(String.format(
                "Ticket %s belongs to event %s, not %s", ticket.getId(), ticket.getEventId(), event.getId()));
        }
        if (ticket.isRefunded()) {
            ledgerMetrics.recordRefund("already_refunded");
            log.info("Ticket {} already refunded by transaction {}, skipping",
                    ticket.getId(), ticket.getRefundTransactionId());
            return false;
        }

        try {
            TransferResult refund = transferEngine.transfer(TransferRequest.builder()
                .fromUserId(event.getCreatorId())
                .toUserId(ticket.getFanId())
                .amountCents(ticket.getPricePaidCents())
                .transactionType(TransactionType.REFUND)
                .referenceType(ReferenceType.EVENT_REFUND)
                .referenceId(ticket.getId())
                .debitDescription("Refund issued for " + event.getTitle())
                .creditDescription("Refund for " + event.getTitle())
                .metadata(LedgerMetadata.builder()
                    .eventId(event.getId())
                    .eventTitle(event.getTitle())
                    .ticketId(ticket.getId())
                    .reason(reason)
                    .build())
                .build());

            ticket.markRefunded(refund.getTransactionId());
            EventTicket refunded = ticket.toDomain();
            outboxService.saveEvent(LiveEventFact.AGGREGATE_TYPE, event.getId(),
                    TicketRefundedFact.EVENT_TYPE, TicketRefundedFact.from(refunded, reason));

            ledgerMetrics.recordRefund("success");
            log.info("Refund applied: ticketId={}, eventId={}, reason={}, transactionId={}",
                    ticket.getId(), event.getId(), reason, refund.getTransactionId());
            return true;

        } catch (LedgerException e) {
            ledgerMetrics.recordRefund(e.getErrorCode().name().toLowerCase());
            throw e;
        }
    }
}
