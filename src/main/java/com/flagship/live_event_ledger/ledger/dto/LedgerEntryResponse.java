package com.flagship.live_event_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.live_event_ledger.ledger.EntryType;
import com.flagship.live_event_ledger.ledger.LedgerEntry;
import com.flagship.live_event_ledger.ledger.LedgerMetadata;
import com.flagship.live_event_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("wallet_id")
    UUID walletId;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("transaction_type")
    TransactionType transactionType;

    @JsonProperty("amount_cents")
    long amountCents;

    @JsonProperty("balance_after_cents")
    long balanceAfterCents;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("reference_type")
    String referenceType;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("description")
    String description;

    @JsonProperty("metadata")
    LedgerMetadata metadata;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .transactionId(entry.getTransactionId())
            .walletId(entry.getWalletId())
            .userId(entry.getUserId())
            .entryType(entry.getEntryType())
            .transactionType(entry.getTransactionType())
            .amountCents(entry.getAmountCents())
            .balanceAfterCents(entry.getBalanceAfterCents())
            .currency(entry.getCurrency().name())
            .referenceType(entry.getReferenceType() != null ? entry.getReferenceType().getCode() : null)
            .referenceId(entry.getReferenceId())
            .description(entry.getDescription())
            .metadata(entry.getMetadata())
            .sequenceNumber(entry.getSequenceNumber())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
