package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The event is CANCELLED but at least one ticket is still unrefunded.
 * Calling cancel again resumes from the outstanding tickets.
 */
@Getter
public class CancellationIncompleteException extends LedgerException {

    private final UUID eventId;
    private final UUID failedTicketId;
    private final int refundedCount;
    private final int outstandingCount;

    public CancellationIncompleteException(UUID eventId, UUID failedTicketId,
                                           int refundedCount, int outstandingCount, Throwable cause) {
        super(ErrorCode.CANCELLATION_INCOMPLETE,
                String.format("Cancellation of event %s stopped at ticket %s: refunded=%d, outstanding=%d",
                        eventId, failedTicketId, refundedCount, outstandingCount),
                cause);
        this.eventId = eventId;
        this.failedTicketId = failedTicketId;
        this.refundedCount = refundedCount;
        this.outstandingCount = outstandingCount;
    }
}
