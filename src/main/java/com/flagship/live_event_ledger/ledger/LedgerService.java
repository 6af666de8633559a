package com.flagship.live_event_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.live_event_ledger.exception.IntegrityException;
import com.flagship.live_event_ledger.wallet.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Append-only double-entry ledger over JDBC.
 *
 * Entries are only ever inserted; a database trigger rejects UPDATE and
 * DELETE. Balance across a transaction is not checked at write time: the
 * transfer engine writes both halves in one database transaction, and
 * {@link #findUnbalancedTransactions()} audits the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final String SELECT_ENTRY =
        "SELECT id, transaction_id, wallet_id, user_id, entry_type, transaction_type, amount_cents, " +
        "balance_after_cents, currency, reference_type, reference_id, description, metadata, " +
        "sequence_number, created_at FROM ledger_entries ";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Writes one entry as part of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void append(LedgerEntry entry) {
        if (entry.getAmountCents() <= 0) {
            throw new IntegrityException("Ledger entry amount must be positive: " + entry.getAmountCents());
        }

        int rows = jdbcTemplate.update(
            "INSERT INTO ledger_entries (id, transaction_id, wallet_id, user_id, entry_type, transaction_type, " +
            "amount_cents, balance_after_cents, currency, reference_type, reference_id, description, metadata) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb))",
            entry.getId() != null ? entry.getId() : UUID.randomUUID(),
            entry.getTransactionId(),
            entry.getWalletId(),
            entry.getUserId(),
            entry.getEntryType().name(),
            entry.getTransactionType().name(),
            entry.getAmountCents(),
            entry.getBalanceAfterCents(),
            entry.getCurrency().name(),
            entry.getReferenceType() != null ? entry.getReferenceType().getCode() : null,
            entry.getReferenceId(),
            entry.getDescription(),
            writeMetadata(entry.getMetadata())
        );

        if (rows != 1) {
            throw new IntegrityException("Ledger insert affected " + rows + " rows for transaction " + entry.getTransactionId());
        }
    }

    /**
     * Credits minus debits for one transaction. Zero for every transaction
     * the engine committed.
     */
    @Transactional(readOnly = true)
    public long sumByTransaction(UUID transactionId) {
        Long sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN entry_type = 'CREDIT' THEN amount_cents ELSE -amount_cents END), 0) " +
            "FROM ledger_entries WHERE transaction_id = ?",
            Long.class,
            transactionId
        );
        return sum != null ? sum : 0L;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntriesForTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE transaction_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transactionId
        );
    }

    /**
     * A user's history, newest first.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntriesForUser(UUID userId, int limit, int offset) {
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE user_id = ? ORDER BY sequence_number DESC LIMIT ? OFFSET ?",
            ledgerEntryRowMapper(),
            userId,
            limit,
            offset
        );
    }

    /**
     * Every transaction that is not exactly one debit and one credit of the
     * same amount.
     */
    @Transactional(readOnly = true)
    public List<UnbalancedTransaction> findUnbalancedTransactions() {
        return jdbcTemplate.query(
            "SELECT transaction_id, " +
            "  COALESCE(SUM(amount_cents) FILTER (WHERE entry_type = 'DEBIT'), 0) AS debit_cents, " +
            "  COALESCE(SUM(amount_cents) FILTER (WHERE entry_type = 'CREDIT'), 0) AS credit_cents, " +
            "  COUNT(*) FILTER (WHERE entry_type = 'DEBIT') AS debit_count, " +
            "  COUNT(*) FILTER (WHERE entry_type = 'CREDIT') AS credit_count " +
            "FROM ledger_entries GROUP BY transaction_id " +
            "HAVING COALESCE(SUM(amount_cents) FILTER (WHERE entry_type = 'DEBIT'), 0) " +
            "    <> COALESCE(SUM(amount_cents) FILTER (WHERE entry_type = 'CREDIT'), 0) " +
            "  OR COUNT(*) FILTER (WHERE entry_type = 'DEBIT') <> 1 " +
            "  OR COUNT(*) FILTER (WHERE entry_type = 'CREDIT') <> 1",
            (rs, rowNum) -> new UnbalancedTransaction(
                UUID.fromString(rs.getString("transaction_id")),
                rs.getLong("debit_cents"),
                rs.getLong("credit_cents"),
                rs.getInt("debit_count"),
                rs.getInt("credit_count")
            )
        );
    }

    @Transactional(readOnly = true)
    public ReconciliationReport reconcile() {
        List<UnbalancedTransaction> unbalanced = findUnbalancedTransactions();
        if (unbalanced.isEmpty()) {
            log.info("Ledger reconciliation passed");
        } else {
            log.error("Ledger reconciliation found {} unbalanced transactions, first={}",
                    unbalanced.size(), unbalanced.get(0).getTransactionId());
        }
        return new ReconciliationReport(Instant.now(), unbalanced);
    }

    private String writeMetadata(LedgerMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize ledger metadata", e);
        }
    }

    private LedgerMetadata readMetadata(String json, UUID entryId) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, LedgerMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IntegrityException("Unreadable metadata on ledger entry " + entryId, e);
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> {
            UUID id = UUID.fromString(rs.getString("id"));
            String referenceType = rs.getString("reference_type");
            String referenceId = rs.getString("reference_id");
            OffsetDateTime createdAt = rs.getObject("created_at", OffsetDateTime.class);

            return LedgerEntry.builder()
                .id(id)
                .transactionId(UUID.fromString(rs.getString("transaction_id")))
                .walletId(UUID.fromString(rs.getString("wallet_id")))
                .userId(UUID.fromString(rs.getString("user_id")))
                .entryType(EntryType.valueOf(rs.getString("entry_type")))
                .transactionType(TransactionType.valueOf(rs.getString("transaction_type")))
                .amountCents(rs.getLong("amount_cents"))
                .balanceAfterCents(rs.getLong("balance_after_cents"))
                .currency(CurrencyCode.valueOf(rs.getString("currency")))
                .referenceType(referenceType != null ? ReferenceType.fromCode(referenceType) : null)
                .referenceId(referenceId != null ? UUID.fromString(referenceId) : null)
                .description(rs.getString("description"))
                .metadata(readMetadata(rs.getString("metadata"), id))
                .sequenceNumber(rs.getLong("sequence_number"))
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .build();
        };
    }
}
