package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class InsufficientFundsException extends LedgerException {

    private final UUID userId;
    private final long requestedCents;
    private final long availableCents;

    public InsufficientFundsException(UUID userId, long requestedCents, long availableCents) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
                String.format("Insufficient balance: requested=%d, available=%d", requestedCents, availableCents));
        this.userId = userId;
        this.requestedCents = requestedCents;
        this.availableCents = availableCents;
    }
}
