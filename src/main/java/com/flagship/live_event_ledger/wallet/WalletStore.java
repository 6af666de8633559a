package com.flagship.live_event_ledger.wallet;

import com.flagship.live_event_ledger.exception.IntegrityException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * JDBC access to wallet rows.
 *
 * Locks are plain {@code SELECT ... FOR UPDATE} row locks held until the
 * caller's transaction ends, which is why every locking method requires one.
 * The store applies deltas as told; refusing to overdraw is the transfer
 * engine's job, with the table's CHECK constraints as the last guard.
 */
@Repository
@RequiredArgsConstructor
public class WalletStore {

    private static final String SELECT_WALLET =
        "SELECT id, user_id, available_balance_cents, total_balance_cents, currency, created_at, updated_at " +
        "FROM wallets ";

    private final JdbcTemplate jdbcTemplate;

    public Optional<Wallet> findByUserId(UUID userId) {
        return single(jdbcTemplate.query(SELECT_WALLET + "WHERE user_id = ?", walletRowMapper(), userId));
    }

    /**
     * Creates the user's wallet if absent and returns it. Safe to race: the
     * unique constraint on user_id turns the loser's insert into a no-op.
     */
    @Transactional
    public Wallet openWallet(UUID userId, CurrencyCode currency) {
        jdbcTemplate.update(
            "INSERT INTO wallets (id, user_id, available_balance_cents, total_balance_cents, currency) " +
            "VALUES (?, ?, 0, 0, ?) ON CONFLICT (user_id) DO NOTHING",
            UUID.randomUUID(),
            userId,
            currency.name()
        );
        return findByUserId(userId)
            .orElseThrow(() -> new IntegrityException("Wallet for user " + userId + " missing after insert"));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Wallet> lockWallet(UUID userId) {
        return single(jdbcTemplate.query(SELECT_WALLET + "WHERE user_id = ? FOR UPDATE", walletRowMapper(), userId));
    }

    /**
     * Locks the wallets of all given users in ascending user ID order, the
     * one order every caller uses, so two transfers over the same pair can
     * never wait on each other in a cycle.
     *
     * @return wallets keyed by user ID, in lock order; users without a wallet are absent
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<UUID, Wallet> lockWallets(Collection<UUID> userIds) {
        Map<UUID, Wallet> locked = new LinkedHashMap<>();
        for (UUID userId : new TreeSet<>(userIds)) {
            lockWallet(userId).ifPresent(wallet -> locked.put(userId, wallet));
        }
        return locked;
    }

    /**
     * Adds the deltas to a wallet the caller has locked.
     *
     * @return the balances after the update, or empty if no row was touched
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<WalletBalance> applyDelta(UUID walletId, long deltaAvailableCents, long deltaTotalCents) {
        return single(jdbcTemplate.query(
            "UPDATE wallets SET " +
            "available_balance_cents = available_balance_cents + ?, " +
            "total_balance_cents = total_balance_cents + ?, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? " +
            "RETURNING id, available_balance_cents, total_balance_cents",
            (rs, rowNum) -> new WalletBalance(
                UUID.fromString(rs.getString("id")),
                rs.getLong("available_balance_cents"),
                rs.getLong("total_balance_cents")
            ),
            deltaAvailableCents,
            deltaTotalCents,
            walletId
        ));
    }

    private static <T> Optional<T> single(List<T> rows) {
        if (rows.size() > 1) {
            throw new IntegrityException("Expected at most one wallet row, got " + rows.size());
        }
        return rows.stream().findFirst();
    }

    private RowMapper<Wallet> walletRowMapper() {
        return (rs, rowNum) -> new Wallet(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("user_id")),
            rs.getLong("available_balance_cents"),
            rs.getLong("total_balance_cents"),
            CurrencyCode.valueOf(rs.getString("currency")),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
        );
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
