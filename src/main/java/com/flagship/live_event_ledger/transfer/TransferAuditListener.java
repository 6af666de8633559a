package com.flagship.live_event_ledger.transfer;

import com.flagship.live_event_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Counts and logs transfers once they are durable. A transfer that ran but
 * was rolled back by its caller (for example a ticket insert failing after
 * the money moved) never reaches this listener.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransferAuditListener {

    private final LedgerMetrics ledgerMetrics;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTransferCommitted(TransferCommittedEvent event) {
        TransferResult result = event.getResult();
        try {
            ledgerMetrics.recordTransfer(result.getTransactionType().name(), "committed");
            log.info("Transfer committed: transactionId={}, type={}, amountCents={}, from={}, to={}",
                    result.getTransactionId(), result.getTransactionType(), result.getAmountCents(),
                    result.getFromUserId(), result.getToUserId());
        } catch (Exception e) {
            log.warn("Transfer audit hook failed for transaction {}: {}", result.getTransactionId(), e.getMessage());
        }
    }
}
