package com.flagship.live_event_ledger.event.notification;

import com.flagship.live_event_ledger.event.EventTip;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The sender is kept even for anonymous tips; anonymity applies to the
 * audience, not to downstream accounting.
 */
@Value
public class TipSentFact implements LiveEventFact {
    UUID factId;
    UUID liveEventId;
    UUID tipId;
    UUID fromUserId;
    UUID toUserId;
    long amountCents;
    boolean anonymous;
    UUID transactionId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TipSent";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TipSentFact from(EventTip tip) {
        return new TipSentFact(
            UUID.randomUUID(),
            tip.getEventId(),
            tip.getId(),
            tip.getFromUserId(),
            tip.getToUserId(),
            tip.getAmountCents(),
            tip.isAnonymous(),
            tip.getTransactionId(),
            Instant.now()
        );
    }
}
