package com.flagship.live_event_ledger.ledger;

import com.flagship.live_event_ledger.support.IntegrationTestSupport;
import com.flagship.live_event_ledger.transfer.TransferEngine;
import com.flagship.live_event_ledger.transfer.TransferRequest;
import com.flagship.live_event_ledger.transfer.TransferResult;
import com.flagship.live_event_ledger.wallet.CurrencyCode;
import com.flagship.live_event_ledger.wallet.Wallet;
import com.flagship.live_event_ledger.wallet.WalletService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger guarantees enforced below the transfer engine: appends need a
 * transaction, stored rows are immutable and reconciliation finds anything
 * that is not one debit plus one equal credit.
 */
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceTest extends IntegrationTestSupport {

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private WalletService walletService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    @DisplayName("Append outside a transaction is refused")
    void testAppend_RequiresTransaction() {
        printTestHeader("Append without transaction");

        // GIVEN
        UUID userId = fundedUser(1_000);
        Wallet wallet = walletService.getWallet(userId);

        // WHEN / THEN
        assertThrows(IllegalTransactionStateException.class,
            () -> ledgerService.append(entry(UUID.randomUUID(), wallet, EntryType.CREDIT, 100)));
        assertEquals(0, ledgerEntryCount(userId));

        printSuccess("MANDATORY propagation enforced");
    }

    @Test
    @DisplayName("Stored entries cannot be updated or deleted")
    void testLedger_IsAppendOnly() {
        printTestHeader("Append-only ledger");

        // GIVEN
        UUID fan = fundedUser(5_000);
        UUID creator = fundedUser(0);
        TransferResult result = transferEngine.transfer(TransferRequest.builder()
            .fromUserId(fan)
            .toUserId(creator)
            .amountCents(1_000)
            .transactionType(TransactionType.TIP)
            .referenceType(ReferenceType.EVENT_TIP)
            .referenceId(UUID.randomUUID())
            .build());
        UUID txId = result.getTransactionId();

        // WHEN / THEN
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE ledger_entries SET amount_cents = 1 WHERE transaction_id = ?", txId));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "DELETE FROM ledger_entries WHERE transaction_id = ?", txId));

        List<LedgerEntry> entries = ledgerService.getEntriesForTransaction(txId);
        assertEquals(2, entries.size());
        assertTrue(entries.stream().allMatch(e -> e.getAmountCents() == 1_000));

        printSuccess("Trigger rejected both mutations");
    }

    @Test
    @DisplayName("Reconciliation reports a one-sided transaction and not a balanced one")
    void testReconcile_FindsUnbalancedTransaction() {
        printTestHeader("Reconciliation");

        // GIVEN
        UUID fan = fundedUser(5_000);
        UUID creator = fundedUser(0);
        TransferResult balanced = transferEngine.transfer(TransferRequest.builder()
            .fromUserId(fan)
            .toUserId(creator)
            .amountCents(2_500)
            .transactionType(TransactionType.PAYMENT)
            .referenceType(ReferenceType.EVENT_TICKET)
            .referenceId(UUID.randomUUID())
            .build());

        Wallet wallet = walletService.getWallet(fan);
        UUID oneSided = UUID.randomUUID();
        transactionTemplate.executeWithoutResult(status ->
            ledgerService.append(entry(oneSided, wallet, EntryType.DEBIT, 700)));
        printInput("One-sided transaction", oneSided);

        // WHEN
        ReconciliationReport report = ledgerService.reconcile();

        // THEN
        List<UUID> flagged = report.getUnbalancedTransactions().stream()
            .map(UnbalancedTransaction::getTransactionId)
            .toList();
        printOutput("Flagged", flagged.size());
        assertTrue(flagged.contains(oneSided));
        assertFalse(flagged.contains(balanced.getTransactionId()));
        assertEquals(-700, ledgerService.sumByTransaction(oneSided));
        assertEquals(0, ledgerService.sumByTransaction(balanced.getTransactionId()));

        printSuccess("Only the planted transaction flagged");
    }

    private static LedgerEntry entry(UUID transactionId, Wallet wallet, EntryType type, long amountCents) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .transactionId(transactionId)
            .walletId(wallet.getId())
            .userId(wallet.getUserId())
            .entryType(type)
            .transactionType(TransactionType.TIP)
            .amountCents(amountCents)
            .balanceAfterCents(wallet.getAvailableBalanceCents())
            .currency(CurrencyCode.USD)
            .build();
    }
}
