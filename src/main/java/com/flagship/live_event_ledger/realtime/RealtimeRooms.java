package com.flagship.live_event_ledger.realtime;

import java.util.UUID;

public final class RealtimeRooms {

    private RealtimeRooms() {
    }

    public static String forEvent(UUID eventId) {
        return "event:" + eventId;
    }
}
