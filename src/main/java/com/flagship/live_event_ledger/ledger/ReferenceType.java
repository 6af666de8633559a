package com.flagship.live_event_ledger.ledger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * What a ledger transaction was recorded for. The code is the value stored
 * in {@code ledger_entries.reference_type}.
 */
@Getter
@RequiredArgsConstructor
public enum ReferenceType {
    EVENT_TICKET("event_ticket"),
    EVENT_TIP("event_tip"),
    EVENT_REFUND("event_refund");

    private final String code;

    public static ReferenceType fromCode(String code) {
        return Arrays.stream(values())
            .filter(type -> type.code.equals(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown reference type: " + code));
    }
}
