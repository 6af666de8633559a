package com.flagship.live_event_ledger.exception;

import lombok.Getter;

/**
 * Root of the service's business failures.
 *
 * Every subclass aborts the enclosing transaction; nothing it guarded is
 * written.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    public LedgerException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
