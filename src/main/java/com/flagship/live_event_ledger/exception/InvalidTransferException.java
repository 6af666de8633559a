package com.flagship.live_event_ledger.exception;

/**
 * Malformed money movement: non-positive amount, self-transfer, mismatched
 * currency or price.
 */
public class InvalidTransferException extends LedgerException {

    public InvalidTransferException(String message) {
        super(ErrorCode.INVALID_AMOUNT, message);
    }
}
