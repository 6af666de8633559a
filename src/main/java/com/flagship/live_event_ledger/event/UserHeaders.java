package com.flagship.live_event_ledger.event;

/**
 * Request headers set by the API gateway after authentication.
 */
final class UserHeaders {

    static final String USER_ID = "X-User-Id";
    static final String IDEMPOTENCY_KEY = "Idempotency-Key";

    private UserHeaders() {
    }
}
