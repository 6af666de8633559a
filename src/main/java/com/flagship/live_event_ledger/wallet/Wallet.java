package com.flagship.live_event_ledger.wallet;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One user's balance row, the unit of locking for every transfer.
 *
 * Invariant: {@code totalBalanceCents >= availableBalanceCents >= 0}. The
 * difference is held funds, which no operation of this service spends.
 */
@Value
public class Wallet {
    UUID id;
    UUID userId;
    long availableBalanceCents;
    long totalBalanceCents;
    CurrencyCode currency;
    Instant createdAt;
    Instant updatedAt;

    public long getHeldBalanceCents() {
        return totalBalanceCents - availableBalanceCents;
    }

    public boolean canCover(long amountCents) {
        return availableBalanceCents >= amountCents;
    }
}
