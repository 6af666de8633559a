package com.flagship.live_event_ledger.wallet;

import lombok.Value;

import java.util.UUID;

/**
 * Balances as returned by the row an update actually touched.
 */
@Value
public class WalletBalance {
    UUID walletId;
    long availableBalanceCents;
    long totalBalanceCents;
}
