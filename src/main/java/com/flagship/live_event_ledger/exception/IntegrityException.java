package com.flagship.live_event_ledger.exception;

/**
 * A write that must have touched exactly one row did not, or stored state
 * disagrees with what was computed under lock. Never retried.
 */
public class IntegrityException extends LedgerException {

    public IntegrityException(String message) {
        super(ErrorCode.INTEGRITY_ERROR, message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(ErrorCode.INTEGRITY_ERROR, message, cause);
    }
}
