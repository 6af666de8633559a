package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.exception.CancellationIncompleteException;
import com.flagship.live_event_ledger.observability.CorrelationContext;
import com.flagship.live_event_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Cancels an event and refunds every outstanding ticket.
 *
 * Not transactional itself. The status flip commits first, then each ticket
 * is refunded in its own transaction, then revenue is zeroed. If a refund
 * fails the event stays CANCELLED with the remaining tickets outstanding,
 * and calling {@link #cancelEvent(UUID, UUID)} again picks up where it
 * stopped. Only transient lock and serialization failures are retried.
 */
@Service
@Slf4j
public class EventCancellationService {

    private final LiveEventService liveEventService;
    private final TicketRefundService ticketRefundService;
    private final EventTicketRepository ticketRepository;
    private final LedgerMetrics ledgerMetrics;
    private final int maxAttempts;

    public EventCancellationService(LiveEventService liveEventService,
                                    TicketRefundService ticketRefundService,
                                    EventTicketRepository ticketRepository,
                                    LedgerMetrics ledgerMetrics,
                                    @Value("${ledger.refund.max-attempts:3}") int maxAttempts) {
        this.liveEventService = liveEventService;
        this.ticketRefundService = ticketRefundService;
        this.ticketRepository = ticketRepository;
        this.ledgerMetrics = ledgerMetrics;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * @throws CancellationIncompleteException if any refund could not be committed
     */
    public LiveEvent cancelEvent(UUID eventId, UUID creatorId) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putOperation(eventId, creatorId);

        try {
            liveEventService.beginCancellation(eventId, creatorId);

            List<UUID> outstanding = ticketRepository.findOutstandingTicketIds(eventId);
            int refunded = 0;
            for (int i = 0; i < outstanding.size(); i++) {
                UUID ticketId = outstanding.get(i);
                try {
                    if (refundWithRetry(eventId, ticketId)) {
                        refunded++;
                    }
                } catch (RuntimeException e) {
                    int remaining = outstanding.size() - i;
                    ledgerMetrics.recordCancellationFailure();
                    log.error("CRITICAL: cancellation of event {} stopped at ticket {}: refunded={}, outstanding={}, error={}",
                            eventId, ticketId, refunded, remaining, e.getMessage(), e);
                    throw new CancellationIncompleteException(eventId, ticketId, refunded, remaining, e);
                }
            }

            LiveEvent cancelled = liveEventService.completeCancellation(eventId);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordLatency("cancel_event", duration);
            log.info("Event cancellation complete: refunded={}, duration={}ms", refunded, duration);
            return cancelled;

        } finally {
            CorrelationContext.clearOperation();
        }
    }

    private boolean refundWithRetry(UUID eventId, UUID ticketId) {
        for (int attempt = 1; ; attempt++) {
            try {
                return ticketRefundService.refundForCancellation(eventId, ticketId);
            } catch (TransientDataAccessException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Refund of ticket {} hit a transient failure (attempt {}/{}), retrying: {}",
                        ticketId, attempt, maxAttempts, e.getMessage());
            }
        }
    }
}
