package com.flagship.live_event_ledger.ledger;

import com.flagship.live_event_ledger.wallet.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable half of a ledger transaction.
 *
 * {@code balanceAfterCents} is the wallet's available balance right after
 * this entry was applied. {@code sequenceNumber} and {@code createdAt} are
 * assigned by the database and null on entries not yet written.
 */
@Value
@Builder
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID walletId;
    UUID userId;
    EntryType entryType;
    TransactionType transactionType;
    long amountCents;
    long balanceAfterCents;
    CurrencyCode currency;
    ReferenceType referenceType;
    UUID referenceId;
    String description;
    LedgerMetadata metadata;
    Long sequenceNumber;
    Instant createdAt;

    public long getSignedAmountCents() {
        return entryType.signed(amountCents);
    }
}
