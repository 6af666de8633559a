package com.flagship.live_event_ledger.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "event_tickets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EventTicketEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "fan_id", nullable = false, updatable = false)
    private UUID fanId;

    @Column(name = "price_paid_cents", nullable = false, updatable = false)
    private long pricePaidCents;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    /**
     * Set once by {@link #markRefunded(UUID)}; a second refund is rejected.
     */
    @Column(name = "refund_transaction_id")
    private UUID refundTransactionId;

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private Instant purchasedAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @PrePersist
    protected void onCreate() {
        if (purchasedAt == null) {
            purchasedAt = Instant.now();
        }
    }

    /**
     * The ticket ID is chosen before payment so the ledger can reference it.
     */
    public static EventTicketEntity create(UUID ticketId, UUID eventId, UUID fanId, long pricePaidCents,
                                           UUID transactionId) {
        return new EventTicketEntity(ticketId, eventId, fanId, pricePaidCents, transactionId,
                null, Instant.now(), null);
    }

    /**
     * @throws IllegalStateException if the ticket was already refunded
     */
    public void markRefunded(UUID refundTransactionId) {
        if (this.refundedAt != null) {
            throw new IllegalStateException(
                String.format("Ticket %s was already refunded by transaction %s", id, this.refundTransactionId));
        }
        this.refundTransactionId = refundTransactionId;
        this.refundedAt = Instant.now();
    }

    public boolean isRefunded() {
        return refundedAt != null;
    }

    public EventTicket toDomain() {
        return new EventTicket(id, eventId, fanId, pricePaidCents, transactionId,
                refundTransactionId, purchasedAt, refundedAt);
    }
}
