package com.flagship.live_event_ledger.transfer;

import lombok.Value;

/**
 * Published inside the transfer's transaction and delivered to
 * {@code AFTER_COMMIT} listeners only if the enclosing transaction commits.
 */
@Value
public class TransferCommittedEvent {
    TransferResult result;
}
