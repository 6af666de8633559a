package com.flagship.live_event_ledger.wallet.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.live_event_ledger.wallet.Wallet;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WalletResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("available_balance_cents")
    long availableBalanceCents;

    @JsonProperty("total_balance_cents")
    long totalBalanceCents;

    @JsonProperty("held_balance_cents")
    long heldBalanceCents;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static WalletResponse from(Wallet wallet) {
        return WalletResponse.builder()
            .id(wallet.getId())
            .userId(wallet.getUserId())
            .availableBalanceCents(wallet.getAvailableBalanceCents())
            .totalBalanceCents(wallet.getTotalBalanceCents())
            .heldBalanceCents(wallet.getHeldBalanceCents())
            .currency(wallet.getCurrency().name())
            .updatedAt(wallet.getUpdatedAt())
            .build();
    }
}
