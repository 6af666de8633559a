package com.flagship.live_event_ledger.entitlement;

import java.util.UUID;

/**
 * Answers whether a user may join a subscription-only or tier-gated event.
 * Backed by the subscription system in production.
 */
public interface EntitlementService {

    boolean hasEntitlement(UUID userId, UUID eventId);
}
