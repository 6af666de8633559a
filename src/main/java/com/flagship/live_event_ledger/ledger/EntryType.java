package com.flagship.live_event_ledger.ledger;

/**
 * Side of a double-entry pair. A DEBIT lowers the wallet's balance, a
 * CREDIT raises it; every transaction has exactly one of each.
 */
public enum EntryType {
    DEBIT,
    CREDIT;

    public long signed(long amountCents) {
        return this == CREDIT ? amountCents : -amountCents;
    }
}
