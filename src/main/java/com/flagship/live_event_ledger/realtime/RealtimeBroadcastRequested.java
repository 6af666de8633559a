package com.flagship.live_event_ledger.realtime;

import lombok.Value;

/**
 * Application event asking for a broadcast once the publishing transaction
 * commits. Nothing is sent for a transaction that rolls back.
 */
@Value
public class RealtimeBroadcastRequested {
    String roomId;
    RealtimeMessage message;
}
