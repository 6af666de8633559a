package com.flagship.live_event_ledger.event;

import lombok.Value;

@Value
public class EventStats {
    LiveEvent event;
    long ticketsSold;
    long tipCount;
    long tipsAmountCents;
    long activeAttendees;
}
