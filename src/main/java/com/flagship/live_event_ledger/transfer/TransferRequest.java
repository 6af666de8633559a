package com.flagship.live_event_ledger.transfer;

import com.flagship.live_event_ledger.exception.InvalidTransferException;
import com.flagship.live_event_ledger.ledger.LedgerMetadata;
import com.flagship.live_event_ledger.ledger.ReferenceType;
import com.flagship.live_event_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * One movement of value from a payer's wallet to a payee's wallet.
 *
 * The metadata is written to both ledger entries; each side's
 * {@code counterpartyUserId} is filled in by the engine.
 */
@Value
@Builder
public class TransferRequest {
    UUID fromUserId;
    UUID toUserId;
    long amountCents;
    TransactionType transactionType;
    ReferenceType referenceType;
    UUID referenceId;
    String debitDescription;
    String creditDescription;
    LedgerMetadata metadata;

    /**
     * @throws InvalidTransferException if the request can never succeed
     */
    public void validate() {
        if (fromUserId == null || toUserId == null) {
            throw new InvalidTransferException("Transfer requires both a payer and a payee");
        }
        if (transactionType == null) {
            throw new InvalidTransferException("Transfer requires a transaction type");
        }
        if (amountCents <= 0) {
            throw new InvalidTransferException("Transfer amount must be positive, got " + amountCents);
        }
        if (fromUserId.equals(toUserId)) {
            throw new InvalidTransferException("Payer and payee must be different users");
        }
    }
}
