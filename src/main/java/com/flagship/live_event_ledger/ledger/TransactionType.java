package com.flagship.live_event_ledger.ledger;

public enum TransactionType {
    /** Fan pays the creator for a ticket. */
    PAYMENT,
    /** Voluntary payment during a live event. */
    TIP,
    /** Compensating movement that reverses a ticket payment. */
    REFUND
}
