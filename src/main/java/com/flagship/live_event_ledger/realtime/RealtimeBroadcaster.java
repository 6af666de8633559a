package com.flagship.live_event_ledger.realtime;

/**
 * Pushes a message to every client subscribed to a room.
 *
 * Fire-and-forget: implementations log delivery failures and never throw
 * back into the caller, which has already committed its money movement.
 */
public interface RealtimeBroadcaster {

    void broadcast(String roomId, RealtimeMessage message);
}
