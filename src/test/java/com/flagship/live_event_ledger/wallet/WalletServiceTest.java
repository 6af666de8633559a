package com.flagship.live_event_ledger.wallet;

import com.flagship.live_event_ledger.exception.WalletNotFoundException;
import com.flagship.live_event_ledger.ledger.EntryType;
import com.flagship.live_event_ledger.ledger.LedgerEntry;
import com.flagship.live_event_ledger.ledger.ReferenceType;
import com.flagship.live_event_ledger.ledger.TransactionType;
import com.flagship.live_event_ledger.support.IntegrationTestSupport;
import com.flagship.live_event_ledger.transfer.TransferEngine;
import com.flagship.live_event_ledger.transfer.TransferRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class WalletServiceTest extends IntegrationTestSupport {

    @Autowired
    private WalletService walletService;

    @Autowired
    private TransferEngine transferEngine;

    @Test
    @DisplayName("Opening a wallet twice returns the same empty wallet")
    void testOpenWallet_Idempotent() {
        printTestHeader("Open wallet");

        // GIVEN
        UUID userId = UUID.randomUUID();

        // WHEN
        Wallet first = walletService.openWallet(userId);
        Wallet second = walletService.openWallet(userId);
        printOutput("Wallet ID", first.getId());

        // THEN
        assertEquals(first.getId(), second.getId());
        assertEquals(0, second.getAvailableBalanceCents());
        assertEquals(CurrencyCode.USD, second.getCurrency());

        printSuccess("One wallet per user");
    }

    @Test
    @DisplayName("Unknown user has no wallet")
    void testGetWallet_NotFound() {
        UUID userId = UUID.randomUUID();

        WalletNotFoundException e = assertThrows(WalletNotFoundException.class,
            () -> walletService.getWallet(userId));

        assertTrue(e.getMessage().contains(userId.toString()));
    }

    @Test
    @DisplayName("History lists the user's entries newest first")
    void testGetHistory_NewestFirst() {
        printTestHeader("Wallet history");

        // GIVEN
        UUID fan = fundedUser(10_000);
        UUID creator = fundedUser(0);
        transfer(fan, creator, 1_000, TransactionType.PAYMENT, ReferenceType.EVENT_TICKET);
        transfer(fan, creator, 250, TransactionType.TIP, ReferenceType.EVENT_TIP);

        // WHEN
        List<LedgerEntry> history = walletService.getHistory(fan, 50, 0);
        printOutput("Entries", history.size());

        // THEN
        assertEquals(2, history.size());
        assertEquals(TransactionType.TIP, history.get(0).getTransactionType());
        assertEquals(8_750, history.get(0).getBalanceAfterCents());
        assertEquals(TransactionType.PAYMENT, history.get(1).getTransactionType());
        assertTrue(history.stream().allMatch(e -> e.getEntryType() == EntryType.DEBIT));

        List<LedgerEntry> page = walletService.getHistory(fan, 1, 1);
        assertEquals(1, page.size());
        assertEquals(TransactionType.PAYMENT, page.get(0).getTransactionType());

        printSuccess("History ordered and paged");
    }

    private void transfer(UUID from, UUID to, long amountCents, TransactionType type, ReferenceType referenceType) {
        transferEngine.transfer(TransferRequest.builder()
            .fromUserId(from)
            .toUserId(to)
            .amountCents(amountCents)
            .transactionType(type)
            .referenceType(referenceType)
            .referenceId(UUID.randomUUID())
            .build());
    }
}
