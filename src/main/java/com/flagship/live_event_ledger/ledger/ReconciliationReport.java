package com.flagship.live_event_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class ReconciliationReport {
    Instant checkedAt;
    List<UnbalancedTransaction> unbalancedTransactions;

    public boolean isBalanced() {
        return unbalancedTransactions.isEmpty();
    }
}
