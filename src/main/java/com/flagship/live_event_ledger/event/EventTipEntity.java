package com.flagship.live_event_ledger.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Tip record. Immutable once written; the idempotency key is a persistence
 * concern and is not part of {@link EventTip}.
 */
@Entity
@Table(name = "event_tips")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EventTipEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "from_user_id", nullable = false, updatable = false)
    private UUID fromUserId;

    @Column(name = "to_user_id", nullable = false, updatable = false)
    private UUID toUserId;

    @Column(name = "amount_cents", nullable = false, updatable = false)
    private long amountCents;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String message;

    @Column(nullable = false, updatable = false)
    private boolean anonymous;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "tipped_at", nullable = false, updatable = false)
    private Instant tippedAt;

    public static EventTipEntity create(UUID tipId, UUID eventId, UUID fromUserId, UUID toUserId, long amountCents,
                                        String message, boolean anonymous, UUID transactionId,
                                        String idempotencyKey) {
        return new EventTipEntity(tipId, eventId, fromUserId, toUserId, amountCents, message, anonymous,
                transactionId, idempotencyKey, Instant.now());
    }

    public EventTip toDomain() {
        return new EventTip(id, eventId, fromUserId, toUserId, amountCents, message, anonymous,
                transactionId, tippedAt);
    }
}
