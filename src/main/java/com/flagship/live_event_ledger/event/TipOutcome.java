package com.flagship.live_event_ledger.event;

import lombok.Value;

/**
 * A tip and whether it was replayed from an earlier request with the same
 * idempotency key rather than sent now.
 */
@Value
public class TipOutcome {
    EventTip tip;
    boolean replayed;
}
