package com.flagship.live_event_ledger.event;

/**
 * Who may join a live event.
 */
public enum AccessType {
    FREE,
    TICKETED,
    SUBSCRIPTION_ONLY,
    TIER_GATED;

    public boolean requiresEntitlement() {
        return this == SUBSCRIPTION_ONLY || this == TIER_GATED;
    }
}
