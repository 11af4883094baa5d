package com.flagship.casino_ledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.config.CasinoProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The wallet ledger: the only component allowed to change a balance.
 *
 * Every mutation is one unit of work that
 * 1. creates the account on first touch (with its opening entry),
 * 2. applies the delta with a single guarded UPDATE, so the read-modify-write
 *    of the balance happens inside the database,
 * 3. appends the matching ledger entry.
 *
 * Resolved entries raise a {@link BalanceResolvedEvent}; rank side effects hang
 * off the commit of that event and can never fail the wallet operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final CasinoProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final UnitOfWork unitOfWork;

    /**
     * Applies a signed delta and records it.
     *
     * @return the balance after the change
     * @throws InsufficientFundsException if the delta would take the balance below zero
     */
    public long adjustBalance(String userId, String guildId, long delta,
                              GameSource source, UpdateKind kind, Map<String, Object> metadata) {
        return unitOfWork.execute("ledger.adjust", () ->
                applyDelta(userId, guildId, delta, source, kind, metadata));
    }

    /**
     * Records an outcome that moves no coins, such as a lost bet whose wager was
     * already taken, or an intermediate round win.
     */
    public long logTransaction(String userId, String guildId,
                               GameSource source, UpdateKind kind, Map<String, Object> metadata) {
        return adjustBalance(userId, guildId, 0, source, kind, metadata);
    }

    public long placeBet(String userId, String guildId, long amount,
                         GameSource source, Map<String, Object> metadata) {
        requirePositive(amount, "Bet amount");
        return adjustBalance(userId, guildId, -amount, source, UpdateKind.BET_PLACED, metadata);
    }

    public long awardWinnings(String userId, String guildId, long amount,
                              GameSource source, Map<String, Object> metadata) {
        requirePositive(amount, "Winnings");
        return adjustBalance(userId, guildId, amount, source, UpdateKind.BET_WON, metadata);
    }

    /**
     * Moves coins between two players of the same community. Both legs land or
     * neither does.
     */
    public TransferResult transfer(String fromUserId, String toUserId, String guildId, long amount) {
        requirePositive(amount, "Transfer amount");
        if (fromUserId.equals(toUserId)) {
            throw new InvalidWagerException("Cannot transfer coins to yourself");
        }

        TransferResult result = unitOfWork.execute("ledger.transfer", () -> {
            lockAccounts(guildId, fromUserId, toUserId);

            long fromBalance = applyDelta(fromUserId, guildId, -amount, GameSource.LOAN,
                    UpdateKind.LOAN_SENT, Map.of("receiver_id", toUserId));
            long toBalance = applyDelta(toUserId, guildId, amount, GameSource.LOAN,
                    UpdateKind.LOAN_RECEIVED, Map.of("sender_id", fromUserId));
            return new TransferResult(fromBalance, toBalance);
        });

        log.info("Transfer completed: guildId={}, from={}, to={}, amount={}",
                guildId, fromUserId, toUserId, amount);
        return result;
    }

    public long getBalance(String userId, String guildId) {
        return getAccount(userId, guildId).getBalance();
    }

    public Account getAccount(String userId, String guildId) {
        return unitOfWork.execute("ledger.account", () -> {
            ensureAccount(userId, guildId);
            return jdbcTemplate.queryForObject(
                "SELECT user_id, guild_id, balance, high_water_balance, beg_count " +
                "FROM users WHERE user_id = ? AND guild_id = ?",
                accountRowMapper(),
                userId, guildId
            );
        });
    }

    public Optional<Account> findAccount(String userId, String guildId) {
        return jdbcTemplate.query(
            "SELECT user_id, guild_id, balance, high_water_balance, beg_count " +
            "FROM users WHERE user_id = ? AND guild_id = ?",
            accountRowMapper(),
            userId, guildId
        ).stream().findFirst();
    }

    /**
     * Last {@code size} resolved entries, oldest first. Intermediate entries are
     * left out so a balance chart does not zig-zag through every bet.
     */
    public List<LedgerEntry> getBalanceHistory(String userId, String guildId, Integer size) {
        int limit = properties.getHistory().clamp(size);
        return jdbcTemplate.query(
            "SELECT * FROM (" +
            "  SELECT id, user_id, guild_id, amount, balance_after, game_source, update_type, metadata, created_at " +
            "  FROM transactions WHERE user_id = ? AND guild_id = ? AND update_type NOT IN (?, ?) " +
            "  ORDER BY id DESC LIMIT ?" +
            ") recent ORDER BY id ASC",
            ledgerEntryRowMapper(),
            userId, guildId, UpdateKind.BET_PLACED.dbValue(), UpdateKind.ROUND_WON.dbValue(), limit
        );
    }

    /**
     * Newest entries of every kind, newest first.
     */
    public List<LedgerEntry> getRecentTransactions(String userId, String guildId, int limit) {
        return jdbcTemplate.query(
            "SELECT id, user_id, guild_id, amount, balance_after, game_source, update_type, metadata, created_at " +
            "FROM transactions WHERE user_id = ? AND guild_id = ? ORDER BY id DESC LIMIT ?",
            ledgerEntryRowMapper(),
            userId, guildId, limit
        );
    }

    /**
     * Loads the account under a row lock held until the caller's transaction
     * ends. Must run inside a transaction.
     */
    public Account lockAccount(String userId, String guildId) {
        ensureAccount(userId, guildId);
        return jdbcTemplate.queryForObject(
            "SELECT user_id, guild_id, balance, high_water_balance, beg_count " +
            "FROM users WHERE user_id = ? AND guild_id = ? FOR UPDATE",
            accountRowMapper(),
            userId, guildId
        );
    }

    /**
     * Opens any missing accounts and locks all of them in user id order, so
     * two callers locking the same pair can never deadlock. Must run inside a
     * transaction.
     */
    public void lockAccounts(String guildId, String... userIds) {
        List<String> ordered = Stream.of(userIds).sorted(Comparator.naturalOrder()).toList();
        ordered.forEach(userId -> ensureAccount(userId, guildId));
        ordered.forEach(userId -> jdbcTemplate.query(
            "SELECT balance FROM users WHERE user_id = ? AND guild_id = ? FOR UPDATE",
            (rs, rowNum) -> rs.getLong("balance"),
            userId, guildId
        ));
    }

    public int getBegCount(String userId, String guildId) {
        return findAccount(userId, guildId).map(Account::getBegCount).orElse(0);
    }

    /**
     * Joins the caller's unit of work; used by the beg flow right after the credit.
     */
    public void incrementBegCount(String userId, String guildId) {
        jdbcTemplate.update(
            "UPDATE users SET beg_count = beg_count + 1, updated_at = NOW() WHERE user_id = ? AND guild_id = ?",
            userId, guildId
        );
    }

    private long applyDelta(String userId, String guildId, long delta,
                            GameSource source, UpdateKind kind, Map<String, Object> metadata) {
        ensureAccount(userId, guildId);

        List<Long> updated = jdbcTemplate.query(
            "UPDATE users SET balance = balance + ?, " +
            "high_water_balance = GREATEST(high_water_balance, balance + ?), updated_at = NOW() " +
            "WHERE user_id = ? AND guild_id = ? AND balance + ? >= 0 RETURNING balance",
            (rs, rowNum) -> rs.getLong("balance"),
            delta, delta, userId, guildId, delta
        );

        if (updated.isEmpty()) {
            long current = currentBalance(userId, guildId);
            log.warn("Insufficient funds: userId={}, guildId={}, balance={}, delta={}, source={}",
                    userId, guildId, current, delta, source.dbValue());
            throw new InsufficientFundsException(userId, current, -delta);
        }

        long newBalance = updated.get(0);
        insertEntry(userId, guildId, delta, newBalance, source, kind, metadata);

        log.debug("Ledger entry appended: userId={}, guildId={}, delta={}, balance={}, source={}, kind={}",
                userId, guildId, delta, newBalance, source.dbValue(), kind.dbValue());

        if (kind.isResolved()) {
            eventPublisher.publishEvent(new BalanceResolvedEvent(userId, guildId, newBalance, kind));
        }
        return newBalance;
    }

    private void ensureAccount(String userId, String guildId) {
        long opening = properties.getStartingBalance();
        int created = jdbcTemplate.update(
            "INSERT INTO users (user_id, guild_id, balance, high_water_balance) VALUES (?, ?, ?, ?) " +
            "ON CONFLICT (user_id, guild_id) DO NOTHING",
            userId, guildId, opening, opening
        );
        if (created == 1) {
            insertEntry(userId, guildId, opening, opening, GameSource.ADMIN, UpdateKind.ADMIN_ADJUSTMENT,
                    Map.of("reason", "opening_balance"));
            log.info("Account opened: userId={}, guildId={}, balance={}", userId, guildId, opening);
        }
    }

    private long currentBalance(String userId, String guildId) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT balance FROM users WHERE user_id = ? AND guild_id = ?",
            Long.class,
            userId, guildId
        );
        return balance != null ? balance : 0L;
    }

    private void insertEntry(String userId, String guildId, long amount, long balanceAfter,
                             GameSource source, UpdateKind kind, Map<String, Object> metadata) {
        jdbcTemplate.update(
            "INSERT INTO transactions (user_id, guild_id, amount, balance_after, game_source, update_type, metadata) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?::jsonb)",
            userId, guildId, amount, balanceAfter, source.dbValue(), kind.dbValue(), toJson(metadata)
        );
    }

    private void requirePositive(long amount, String label) {
        if (amount <= 0) {
            throw new InvalidWagerException(label + " must be positive, got " + amount);
        }
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize ledger metadata", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt ledger metadata: " + json, e);
        }
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getString("user_id"),
            rs.getString("guild_id"),
            rs.getLong("balance"),
            rs.getLong("high_water_balance"),
            rs.getInt("beg_count")
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return new LedgerEntry(
                rs.getLong("id"),
                rs.getString("user_id"),
                rs.getString("guild_id"),
                rs.getLong("amount"),
                rs.getLong("balance_after"),
                GameSource.fromDbValue(rs.getString("game_source")),
                UpdateKind.fromDbValue(rs.getString("update_type")),
                fromJson(rs.getString("metadata")),
                createdAt != null ? createdAt.toInstant() : null
            );
        };
    }
}
