package com.flagship.live_event_ledger.event;

import com.flagship.live_event_ledger.event.notification.LiveEventFact;
import com.flagship.live_event_ledger.event.notification.TipSentFact;
import com.flagship.live_event_ledger.exception.EventNotFoundException;
import com.flagship.live_event_ledger.exception.EventNotLiveException;
import com.flagship.live_event_ledger.exception.IdempotencyConflictException;
import com.flagship.live_event_ledger.exception.InvalidTransferException;
import com.flagship.live_event_ledger.exception.LedgerException;
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
 * Tips between users during a live event, by default to its creator.
 *
 * With an idempotency key, a sender's repeated request returns the original
 * tip and moves no money. A key reused for a different event, recipient or
 * amount is a conflict. The database lookup runs after the event lock, so two
 * concurrent requests with the same key are serialised and the second sees
 * the first one's tip.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TipService {

    static final int MAX_MESSAGE_LENGTH = 500;

    private final LiveEventRepository eventRepository;
    private final EventTipRepository tipRepository;
    private final TipIdempotencyService idempotencyService;
    private final TransferEngine transferEngine;
    private final OutboxService outboxService;
    private final EventBroadcasts broadcasts;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @param toUserId any user other than the sender; null means the creator
     * @param idempotencyKey optional, scoped to the sender
     * @throws EventNotLiveException if the event is not LIVE
     * @throws IdempotencyConflictException if the key was used for a different tip
     * @throws com.flagship.live_event_ledger.exception.InsufficientFundsException
     *         if the sender cannot cover the amount
     */
    @Transactional
    public TipOutcome sendTip(UUID eventId, UUID fromUserId, UUID toUserId, long amountCents,
                              String message, boolean anonymous, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        CorrelationContext.putOperation(eventId, fromUserId);

        try {
            if (keyed) {
                Optional<TipOutcome> replay = replay(eventId, fromUserId, toUserId, amountCents, idempotencyKey);
                if (replay.isPresent()) {
                    return replay.get();
                }
            }

            LiveEventEntity eventEntity = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new EventNotFoundException(eventId));
            if (keyed) {
                Optional<EventTipEntity> committed = tipRepository.findByFromUserIdAndIdempotencyKey(fromUserId, idempotencyKey);
                if (committed.isPresent()) {
                    EventTip tip = committed.get().toDomain();
                    requireSameTip(tip, eventId, toUserId, amountCents, idempotencyKey);
                    ledgerMetrics.recordIdempotencyHit();
                    return new TipOutcome(tip, true);
                }
                ledgerMetrics.recordIdempotencyMiss();
            }

            LiveEvent event = eventEntity.toDomain();
            if (!event.isLive()) {
                throw new EventNotLiveException(eventId, event.getStatus().name());
            }
            UUID recipient = toUserId != null ? toUserId : event.getCreatorId();
            if (message != null && message.length() > MAX_MESSAGE_LENGTH) {
                throw new InvalidTransferException("Tip message exceeds " + MAX_MESSAGE_LENGTH + " characters");
            }

            UUID tipId = UUID.randomUUID();
            TransferResult payment = transferEngine.transfer(TransferRequest.builder()
                .fromUserId(fromUserId)
                .toUserId(recipient)
                .amountCents(amountCents)
                .transactionType(TransactionType.TIP)
                .referenceType(ReferenceType.EVENT_TIP)
                .referenceId(tipId)
                .debitDescription("Tip to " + event.getTitle())
                .creditDescription("Tip received during " + event.getTitle())
                .metadata(LedgerMetadata.builder()
                    .eventId(eventId)
                    .eventTitle(event.getTitle())
                    .tipMessage(message)
                    .anonymous(anonymous)
                    .build())
                .build());

            EventTip tip = tipRepository.save(EventTipEntity.create(tipId, eventId, fromUserId, recipient, amountCents,
                    message, anonymous, payment.getTransactionId(), keyed ? idempotencyKey : null)).toDomain();
            eventEntity.recordTip(amountCents);

            outboxService.saveEvent(LiveEventFact.AGGREGATE_TYPE, eventId, TipSentFact.EVENT_TYPE, TipSentFact.from(tip));
            if (keyed) {
                idempotencyService.remember(fromUserId, idempotencyKey, tipId);
            }
            broadcasts.tip(tip);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordTip("success");
            ledgerMetrics.recordLatency("tip", duration);
            log.info("Tip sent: tipId={}, toUserId={}, amountCents={}, anonymous={}, duration={}ms", tipId, recipient, amountCents, anonymous, duration);

            return new TipOutcome(tip, false);

        } catch (LedgerException e) {
            ledgerMetrics.recordTip(e.getErrorCode().name().toLowerCase());
            log.warn("Tip rejected: reason={}", e.getMessage());
            throw e;
        } finally {
            CorrelationContext.clearOperation();
        }
    }

    private Optional<TipOutcome> replay(UUID eventId, UUID fromUserId, UUID toUserId, long amountCents,
                                        String idempotencyKey) {
        Optional<EventTip> existing = idempotencyService.findExistingTip(fromUserId, idempotencyKey);
        existing.ifPresent(tip -> {
            requireSameTip(tip, eventId, toUserId, amountCents, idempotencyKey);
            ledgerMetrics.recordIdempotencyHit();
            log.info("Tip idempotency key already used, returning tip {}", tip.getId());
        });
        return existing.map(tip -> new TipOutcome(tip, true));
    }

    // A null recipient means the creator, which the stored tip already resolved.
    private static void requireSameTip(EventTip tip, UUID eventId, UUID toUserId, long amountCents,
                                       String idempotencyKey) {
        boolean same = tip.getEventId().equals(eventId)
            && tip.getAmountCents() == amountCents
            && (toUserId == null || tip.getToUserId().equals(toUserId));
        if (!same) {
            throw new IdempotencyConflictException(idempotencyKey, tip.getId());
        }
    }
}
