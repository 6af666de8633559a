package com.flagship.live_event_ledger.transfer;

import com.flagship.live_event_ledger.ledger.ReferenceType;
import com.flagship.live_event_ledger.ledger.TransactionType;
import lombok.Value;

import java.util.UUID;

@Value
public class TransferResult {
    UUID transactionId;
    UUID fromUserId;
    UUID toUserId;
    long amountCents;
    TransactionType transactionType;
    ReferenceType referenceType;
    UUID referenceId;
    long fromBalanceAfterCents;
    long toBalanceAfterCents;
}
