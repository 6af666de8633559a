package com.flagship.live_event_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Context attached to a ledger entry, stored as JSON.
 *
 * Fields are optional and typed. Readers must accept any schema version up
 * to {@link #CURRENT_SCHEMA_VERSION}; new fields are added, never renamed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerMetadata {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    @Builder.Default
    int schemaVersion = CURRENT_SCHEMA_VERSION;

    UUID eventId;
    String eventTitle;
    UUID ticketId;
    UUID counterpartyUserId;
    String tipMessage;
    Boolean anonymous;
    String reason;
}
