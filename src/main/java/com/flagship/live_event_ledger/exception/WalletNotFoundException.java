package com.flagship.live_event_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class WalletNotFoundException extends LedgerException {

    private final UUID userId;

    public WalletNotFoundException(UUID userId) {
        super(ErrorCode.WALLET_NOT_FOUND, "Wallet not found for user " + userId);
        this.userId = userId;
    }
}
