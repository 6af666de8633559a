package com.flagship.live_event_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A transaction whose entries do not form exactly one debit and one
 * credit of equal amount.
 */
@Value
public class UnbalancedTransaction {
    UUID transactionId;
    long debitCents;
    long creditCents;
    int debitCount;
    int creditCount;

    public long getImbalanceCents() {
        return creditCents - debitCents;
    }
}
