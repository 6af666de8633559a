package com.flagship.live_event_ledger.transfer;

import com.flagship.live_event_ledger.exception.InsufficientFundsException;
import com.flagship.live_event_ledger.exception.IntegrityException;
import com.flagship.live_event_ledger.exception.InvalidTransferException;
import com.flagship.live_event_ledger.exception.LedgerException;
import com.flagship.live_event_ledger.exception.WalletNotFoundException;
import com.flagship.live_event_ledger.ledger.EntryType;
import com.flagship.live_event_ledger.ledger.LedgerEntry;
import com.flagship.live_event_ledger.ledger.LedgerMetadata;
import com.flagship.live_event_ledger.ledger.LedgerService;
import com.flagship.live_event_ledger.observability.CorrelationContext;
import com.flagship.live_event_ledger.observability.LedgerMetrics;
import com.flagship.live_event_ledger.wallet.Wallet;
import com.flagship.live_event_ledger.wallet.WalletBalance;
import com.flagship.live_event_ledger.wallet.WalletStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Moves value between exactly two wallets, atomically.
 *
 * Steps, all inside the caller's transaction (or a new one):
 * 1. Lock both wallets in ascending user ID order
 * 2. Check the payer's available balance under the lock
 * 3. Compute both resulting balances
 * 4. Debit the payer; a write that touches no row is an integrity error
 * 5. Credit the payee, verified the same way
 * 6. Append the debit and credit ledger entries under one transaction ID
 *
 * Any failure throws, so the enclosing transaction rolls back and nothing
 * is written: no balance change, no ledger entry, no failed-attempt record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferEngine {

    private final WalletStore walletStore;
    private final LedgerService ledgerService;
    private final ApplicationEventPublisher eventPublisher;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public TransferResult transfer(TransferRequest request) {
        request.validate();
        long startTime = System.currentTimeMillis();
        String type = request.getTransactionType().name();

        try {
            Map<UUID, Wallet> locked = walletStore.lockWallets(List.of(request.getFromUserId(), request.getToUserId()));

            Wallet from = locked.get(request.getFromUserId());
            if (from == null) {
                throw new WalletNotFoundException(request.getFromUserId());
            }
            Wallet to = locked.get(request.getToUserId());
            if (to == null) {
                throw new WalletNotFoundException(request.getToUserId());
            }
            if (from.getCurrency() != to.getCurrency()) {
                throw new InvalidTransferException(String.format(
                    "Currency mismatch: payer holds %s, payee holds %s", from.getCurrency(), to.getCurrency()));
            }

            long amount = request.getAmountCents();
            if (!from.canCover(amount)) {
                throw new InsufficientFundsException(from.getUserId(), amount, from.getAvailableBalanceCents());
            }

            long expectedFromAvailable = from.getAvailableBalanceCents() - amount;
            long expectedToAvailable = to.getAvailableBalanceCents() + amount;

            WalletBalance debited = walletStore.applyDelta(from.getId(), -amount, -amount)
                .orElseThrow(() -> new IntegrityException("Debit affected no row for wallet " + from.getId()));
            verifyBalance(debited, expectedFromAvailable);

            WalletBalance credited = walletStore.applyDelta(to.getId(), amount, amount)
                .orElseThrow(() -> new IntegrityException("Credit affected no row for wallet " + to.getId()));
            verifyBalance(credited, expectedToAvailable);

            UUID transactionId = UUID.randomUUID();
            MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId.toString());

            ledgerService.append(entry(request, transactionId, from, EntryType.DEBIT,
                    debited.getAvailableBalanceCents(), request.getDebitDescription(), request.getToUserId()));
            ledgerService.append(entry(request, transactionId, to, EntryType.CREDIT,
                    credited.getAvailableBalanceCents(), request.getCreditDescription(), request.getFromUserId()));

            TransferResult result = new TransferResult(
                transactionId,
                from.getUserId(),
                to.getUserId(),
                amount,
                request.getTransactionType(),
                request.getReferenceType(),
                request.getReferenceId(),
                debited.getAvailableBalanceCents(),
                credited.getAvailableBalanceCents()
            );
            eventPublisher.publishEvent(new TransferCommittedEvent(result));

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordLatency("transfer", duration);
            log.debug("Transfer applied: type={}, amountCents={}, duration={}ms", type, amount, duration);

            return result;

        } catch (IntegrityException e) {
            ledgerMetrics.recordIntegrityError();
            ledgerMetrics.recordTransfer(type, "integrity_error");
            log.error("Transfer integrity failure: type={}, from={}, to={}, error={}",
                    type, request.getFromUserId(), request.getToUserId(), e.getMessage());
            throw e;
        } catch (LedgerException e) {
            ledgerMetrics.recordTransfer(type, e.getErrorCode().name().toLowerCase());
            log.warn("Transfer rejected: type={}, from={}, to={}, reason={}",
                    type, request.getFromUserId(), request.getToUserId(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private static void verifyBalance(WalletBalance balance, long expectedAvailable) {
        if (balance.getAvailableBalanceCents() != expectedAvailable) {
            throw new IntegrityException(String.format(
                "Wallet %s drifted under lock: expected available=%d, stored=%d",
                balance.getWalletId(), expectedAvailable, balance.getAvailableBalanceCents()));
        }
    }

    private static LedgerEntry entry(TransferRequest request, UUID transactionId, Wallet wallet,
                                     EntryType entryType, long balanceAfter, String description,
                                     UUID counterpartyUserId) {
        LedgerMetadata metadata = request.getMetadata() != null
            ? request.getMetadata().toBuilder().counterpartyUserId(counterpartyUserId).build()
            : LedgerMetadata.builder().counterpartyUserId(counterpartyUserId).build();

        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .transactionId(transactionId)
            .walletId(wallet.getId())
            .userId(wallet.getUserId())
            .entryType(entryType)
            .transactionType(request.getTransactionType())
            .amountCents(request.getAmountCents())
            .balanceAfterCents(balanceAfter)
            .currency(wallet.getCurrency())
            .referenceType(request.getReferenceType())
            .referenceId(request.getReferenceId())
            .description(description)
            .metadata(metadata)
            .build();
    }
}
