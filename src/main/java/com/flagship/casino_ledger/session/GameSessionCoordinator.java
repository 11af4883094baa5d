package com.flagship.casino_ledger.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.config.CasinoProperties;
import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.observability.CasinoMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gatekeeper for in-flight games.
 *
 * The session table is the only record of a running game: there is no
 * in-memory registry, so a restart cannot orphan a wager. At most one row per
 * (user, community, game) is active; the guarded upsert in {@link #start} and
 * the partial unique index on active rows enforce it.
 *
 * Abandoned games are detected by age alone. Before every new start the caller
 * runs {@link #checkAndRecover}, which crashes a stale session and refunds its
 * full bet exactly once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameSessionCoordinator {

    private static final String SESSION_COLUMNS =
        "session_id, user_id, guild_id, game_source, status, bet_amount, game_state, " +
        "crash_reason, refund_amount, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final WalletService walletService;
    private final CasinoProperties properties;
    private final Clock clock;
    private final UnitOfWork unitOfWork;
    private final CasinoMetrics metrics;

    /**
     * Arms a session for the key, re-using the finished or crashed row if there is one.
     *
     * @throws GameAlreadyActiveException if a game of this type is still active
     */
    public GameSession start(String userId, String guildId, GameSource source, long betAmount, Object state) {
        Timestamp now = Timestamp.from(clock.instant());
        List<GameSession> armed = unitOfWork.execute("session.start", () -> jdbcTemplate.query(
            "INSERT INTO game_sessions (user_id, guild_id, game_source, status, bet_amount, game_state, created_at, updated_at) " +
            "VALUES (?, ?, ?, 'active', ?, ?::jsonb, ?, ?) " +
            "ON CONFLICT (user_id, game_source, guild_id) DO UPDATE SET " +
            "status = 'active', bet_amount = EXCLUDED.bet_amount, game_state = EXCLUDED.game_state, " +
            "crash_reason = NULL, refund_amount = NULL, created_at = EXCLUDED.created_at, updated_at = EXCLUDED.updated_at " +
            "WHERE game_sessions.status <> 'active' " +
            "RETURNING " + SESSION_COLUMNS,
            sessionRowMapper(),
            userId, guildId, source.dbValue(), betAmount, encodeState(state), now, now
        ));

        if (armed.isEmpty()) {
            throw new GameAlreadyActiveException(userId, guildId, source);
        }

        GameSession session = armed.get(0);
        log.info("Game session started: sessionId={}, userId={}, guildId={}, game={}, bet={}",
                session.getSessionId(), userId, guildId, source.dbValue(), betAmount);
        return session;
    }

    /**
     * Persists the snapshot between rounds. {@code betAmount} is the running
     * total at risk, which is what a crash would refund.
     */
    public GameSession updateState(String userId, String guildId, GameSource source, Object state, long betAmount) {
        List<GameSession> updated = unitOfWork.execute("session.update", () -> jdbcTemplate.query(
            "UPDATE game_sessions SET game_state = ?::jsonb, bet_amount = ?, updated_at = ? " +
            "WHERE user_id = ? AND guild_id = ? AND game_source = ? AND status = 'active' " +
            "RETURNING " + SESSION_COLUMNS,
            sessionRowMapper(),
            encodeState(state), betAmount, Timestamp.from(clock.instant()), userId, guildId, source.dbValue()
        ));
        if (updated.isEmpty()) {
            throw new NoActiveGameException(userId, guildId, source);
        }
        return updated.get(0);
    }

    /**
     * Loads the active session and holds its row lock until the caller's
     * transaction ends, so a round and a crash recovery cannot both settle it.
     * Must run inside a transaction.
     */
    public GameSession lockActive(String userId, String guildId, GameSource source) {
        return jdbcTemplate.query(
            "SELECT " + SESSION_COLUMNS + " FROM game_sessions " +
            "WHERE user_id = ? AND guild_id = ? AND game_source = ? AND status = 'active' FOR UPDATE",
            sessionRowMapper(),
            userId, guildId, source.dbValue()
        ).stream().findFirst().orElseThrow(() -> new NoActiveGameException(userId, guildId, source));
    }

    /**
     * Marks the active session finished.
     *
     * @return false when nothing was active (already finished or crashed)
     */
    public boolean finish(String userId, String guildId, GameSource source) {
        int updated = unitOfWork.execute("session.finish", () -> jdbcTemplate.update(
            "UPDATE game_sessions SET status = 'finished', updated_at = ? " +
            "WHERE user_id = ? AND guild_id = ? AND game_source = ? AND status = 'active'",
            Timestamp.from(clock.instant()), userId, guildId, source.dbValue()
        ));
        if (updated > 0) {
            log.debug("Game session finished: userId={}, guildId={}, game={}", userId, guildId, source.dbValue());
        }
        return updated > 0;
    }

    public boolean hasActiveGame(String userId, String guildId, GameSource source) {
        return getActiveGame(userId, guildId, source).isPresent();
    }

    public Optional<GameSession> getActiveGame(String userId, String guildId, GameSource source) {
        return jdbcTemplate.query(
            "SELECT " + SESSION_COLUMNS + " FROM game_sessions " +
            "WHERE user_id = ? AND guild_id = ? AND game_source = ? AND status = 'active'",
            sessionRowMapper(),
            userId, guildId, source.dbValue()
        ).stream().findFirst();
    }

    public Optional<GameSession> getSession(String userId, String guildId, GameSource source) {
        return jdbcTemplate.query(
            "SELECT " + SESSION_COLUMNS + " FROM game_sessions " +
            "WHERE user_id = ? AND guild_id = ? AND game_source = ?",
            sessionRowMapper(),
            userId, guildId, source.dbValue()
        ).stream().findFirst();
    }

    /**
     * Crashes and refunds the active session if it outlived the crash threshold.
     * Concurrent callers race on a guarded UPDATE, so only one of them writes
     * the crash record and the refund.
     *
     * @return the crash record when this call recovered a session
     */
    public Optional<CrashRecord> checkAndRecover(String userId, String guildId, GameSource source) {
        Duration threshold = properties.getSession().crashThreshold();
        Instant now = clock.instant();

        Optional<GameSession> active = getActiveGame(userId, guildId, source);
        if (active.isEmpty() || !active.get().isAbandoned(now, threshold)) {
            return Optional.empty();
        }

        String reason = "Game timed out after " + threshold.toMinutes() + " minutes";
        Optional<CrashRecord> record = unitOfWork.execute("session.recover", () ->
                crashAndRefund(active.get().getSessionId(), reason, now, now.minus(threshold)));

        record.ifPresent(crash -> {
            metrics.recordCrashRefund(source);
            log.warn("Crashed game recovered: sessionId={}, userId={}, guildId={}, game={}, refund={}, durationSeconds={}",
                    crash.getSessionId(), userId, guildId, source.dbValue(),
                    crash.getRefundAmount(), crash.getDurationSeconds());
        });
        return record;
    }

    public List<CrashRecord> getCrashHistory(String userId, String guildId, int limit) {
        return jdbcTemplate.query(
            "SELECT id, session_id, user_id, guild_id, game_source, bet_amount, refund_amount, crash_reason, " +
            "game_duration_seconds, game_state, game_started_at, crashed_at " +
            "FROM game_crash_history WHERE user_id = ? AND guild_id = ? ORDER BY id DESC LIMIT ?",
            crashRowMapper(),
            userId, guildId, limit
        );
    }

    /**
     * Deletes finished and crashed sessions untouched for {@code days} days.
     * Crash records are kept.
     */
    public int pruneOldGames(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int deleted = jdbcTemplate.update(
            "DELETE FROM game_sessions WHERE status IN ('finished', 'crashed') AND updated_at < ?",
            Timestamp.from(cutoff)
        );
        log.info("Pruned old game sessions: deleted={}, olderThanDays={}", deleted, days);
        return deleted;
    }

    public long countActiveSessions() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM game_sessions WHERE status = 'active'", Long.class);
        return count != null ? count : 0L;
    }

    public <T> T decodeState(GameSession session, Class<T> type) {
        if (session.getStateJson() == null) {
            throw new IllegalStateException("Session " + session.getSessionId() + " has no state snapshot");
        }
        try {
            return objectMapper.readValue(session.getStateJson(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt state snapshot in session " + session.getSessionId(), e);
        }
    }

    private Optional<CrashRecord> crashAndRefund(long sessionId, String reason, Instant now, Instant cutoff) {
        List<GameSession> crashed = jdbcTemplate.query(
            "UPDATE game_sessions SET status = 'crashed', crash_reason = ?, refund_amount = bet_amount, updated_at = ? " +
            "WHERE session_id = ? AND status = 'active' AND created_at < ? " +
            "RETURNING " + SESSION_COLUMNS,
            sessionRowMapper(),
            reason, Timestamp.from(now), sessionId, Timestamp.from(cutoff)
        );
        if (crashed.isEmpty()) {
            return Optional.empty();
        }

        GameSession session = crashed.get(0);
        long durationSeconds = session.age(now).getSeconds();

        CrashRecord record = jdbcTemplate.queryForObject(
            "INSERT INTO game_crash_history (session_id, user_id, guild_id, game_source, bet_amount, refund_amount, " +
            "crash_reason, game_duration_seconds, game_state, game_started_at, crashed_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?) " +
            "RETURNING id, session_id, user_id, guild_id, game_source, bet_amount, refund_amount, crash_reason, " +
            "game_duration_seconds, game_state, game_started_at, crashed_at",
            crashRowMapper(),
            session.getSessionId(), session.getUserId(), session.getGuildId(), session.getSource().dbValue(),
            session.getBetAmount(), session.getBetAmount(), reason, durationSeconds, session.getStateJson(),
            Timestamp.from(session.getCreatedAt()), Timestamp.from(now)
        );

        if (session.getBetAmount() > 0) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("session_id", session.getSessionId());
            metadata.put("crash_reason", reason);
            walletService.adjustBalance(session.getUserId(), session.getGuildId(), session.getBetAmount(),
                    session.getSource(), UpdateKind.CRASH_REFUND, metadata);
        }
        return Optional.ofNullable(record);
    }

    private String encodeState(Object state) {
        if (state == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize game state", e);
        }
    }

    private RowMapper<GameSession> sessionRowMapper() {
        return (rs, rowNum) -> {
            long refundValue = rs.getLong("refund_amount");
            Long refund = rs.wasNull() ? null : refundValue;
            return new GameSession(
                rs.getLong("session_id"),
                rs.getString("user_id"),
                rs.getString("guild_id"),
                GameSource.fromDbValue(rs.getString("game_source")),
                SessionStatus.fromDbValue(rs.getString("status")),
                rs.getLong("bet_amount"),
                rs.getString("game_state"),
                rs.getString("crash_reason"),
                refund,
                instant(rs, "created_at"),
                instant(rs, "updated_at")
            );
        };
    }

    private RowMapper<CrashRecord> crashRowMapper() {
        return (rs, rowNum) -> new CrashRecord(
            rs.getLong("id"),
            rs.getLong("session_id"),
            rs.getString("user_id"),
            rs.getString("guild_id"),
            GameSource.fromDbValue(rs.getString("game_source")),
            rs.getLong("bet_amount"),
            rs.getLong("refund_amount"),
            rs.getString("crash_reason"),
            rs.getLong("game_duration_seconds"),
            rs.getString("game_state"),
            instant(rs, "game_started_at"),
            instant(rs, "crashed_at")
        );
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
