package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A sender reused an idempotency key for a request that does not match the
 * one it was first used for.
 */
@Getter
public class IdempotencyConflictException extends LedgerException {

    private final String idempotencyKey;
    private final UUID existingTipId;

    public IdempotencyConflictException(String idempotencyKey, UUID existingTipId) {
        super(ErrorCode.IDEMPOTENCY_CONFLICT,
                String.format("Idempotency key %s was already used for a different tip", idempotencyKey));
        this.idempotencyKey = idempotencyKey;
        this.existingTipId = existingTipId;
    }
}
