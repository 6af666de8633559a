package com.flagship.live_event_ledger.wallet;

import com.flagship.live_event_ledger.exception.WalletNotFoundException;
import com.flagship.live_event_ledger.ledger.LedgerEntry;
import com.flagship.live_event_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    static final int MAX_HISTORY_PAGE = 200;

    private final WalletStore walletStore;
    private final LedgerService ledgerService;

    @Value("${ledger.default-currency:USD}")
    private CurrencyCode defaultCurrency;

    @Transactional(readOnly = true)
    public Wallet getWallet(UUID userId) {
        return walletStore.findByUserId(userId)
            .orElseThrow(() -> new WalletNotFoundException(userId));
    }

    /**
     * Returns the user's wallet, creating an empty one in the default
     * currency on first use.
     */
    @Transactional
    public Wallet openWallet(UUID userId) {
        Wallet wallet = walletStore.openWallet(userId, defaultCurrency);
        log.debug("Wallet ready: userId={}, walletId={}", userId, wallet.getId());
        return wallet;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getHistory(UUID userId, int limit, int offset) {
        getWallet(userId);
        int pageSize = Math.max(1, Math.min(limit, MAX_HISTORY_PAGE));
        return ledgerService.getEntriesForUser(userId, pageSize, Math.max(0, offset));
    }
}
