package com.flagship.casino_ledger.stats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.ledger.GameSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Per-player, per-game counters, streaks and extremes.
 *
 * Each record is one upsert whose conflict branch computes the new streaks
 * and maxima from the stored row, so two games finishing at the same time
 * cannot overwrite each other. Never moves money.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatsService {

    private static final String NON_GAME_SOURCES = "('loan', 'beg', 'admin')";

    private static final String MERGE_EXTRA_STATS =
        "(SELECT COALESCE(jsonb_object_agg(k, " +
        "  COALESCE((game_stats.extra_stats ->> k)::bigint, 0) + COALESCE((EXCLUDED.extra_stats ->> k)::bigint, 0)" +
        "), '{}'::jsonb) " +
        "FROM (SELECT jsonb_object_keys(game_stats.extra_stats) " +
        "      UNION SELECT jsonb_object_keys(EXCLUDED.extra_stats)) AS keys(k))";

    private static final String STATS_COLUMNS =
        "user_id, guild_id, game_source, games_played, games_won, games_lost, current_win_streak, " +
        "current_losing_streak, best_win_streak, worst_losing_streak, highest_bet, highest_payout, " +
        "highest_loss, extra_stats";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final UnitOfWork unitOfWork;

    /**
     * Records one finished game.
     *
     * @param payout coins returned to the player; only counted towards the highest payout on a win
     */
    public void record(String userId, String guildId, GameSource source,
                       boolean won, long bet, long payout, ExtraCounters extra) {
        int win = won ? 1 : 0;
        int loss = won ? 0 : 1;

        unitOfWork.run("stats.record", () -> jdbcTemplate.update(
            "INSERT INTO game_stats (" + STATS_COLUMNS + ") " +
            "VALUES (?, ?, ?, 1, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb) " +
            "ON CONFLICT (user_id, game_source, guild_id) DO UPDATE SET " +
            "games_played = game_stats.games_played + 1, " +
            "games_won = game_stats.games_won + EXCLUDED.games_won, " +
            "games_lost = game_stats.games_lost + EXCLUDED.games_lost, " +
            "current_win_streak = CASE WHEN EXCLUDED.games_won = 1 THEN game_stats.current_win_streak + 1 ELSE 0 END, " +
            "current_losing_streak = CASE WHEN EXCLUDED.games_lost = 1 THEN game_stats.current_losing_streak + 1 ELSE 0 END, " +
            "best_win_streak = CASE WHEN EXCLUDED.games_won = 1 " +
            "  THEN GREATEST(game_stats.best_win_streak, game_stats.current_win_streak + 1) ELSE game_stats.best_win_streak END, " +
            "worst_losing_streak = CASE WHEN EXCLUDED.games_lost = 1 " +
            "  THEN GREATEST(game_stats.worst_losing_streak, game_stats.current_losing_streak + 1) ELSE game_stats.worst_losing_streak END, " +
            "highest_bet = GREATEST(game_stats.highest_bet, EXCLUDED.highest_bet), " +
            "highest_payout = GREATEST(game_stats.highest_payout, EXCLUDED.highest_payout), " +
            "highest_loss = GREATEST(game_stats.highest_loss, EXCLUDED.highest_loss), " +
            "extra_stats = " + MERGE_EXTRA_STATS + ", " +
            "updated_at = NOW()",
            userId, guildId, source.dbValue(), win, loss,
            win, loss, win, loss,
            bet, won ? payout : 0L, won ? 0L : bet,
            toJson(extra)
        ));

        log.debug("Stats recorded: userId={}, guildId={}, game={}, won={}, bet={}, payout={}",
                userId, guildId, source.dbValue(), won, bet, payout);
    }

    /**
     * Adds counters without counting a game, for rounds that do not end one.
     */
    public void recordExtraCounters(String userId, String guildId, GameSource source, ExtraCounters extra) {
        if (extra == null || extra.isEmpty()) {
            return;
        }
        unitOfWork.run("stats.extra", () -> jdbcTemplate.update(
            "INSERT INTO game_stats (user_id, guild_id, game_source, extra_stats) VALUES (?, ?, ?, ?::jsonb) " +
            "ON CONFLICT (user_id, game_source, guild_id) DO UPDATE SET " +
            "extra_stats = " + MERGE_EXTRA_STATS + ", updated_at = NOW()",
            userId, guildId, source.dbValue(), toJson(extra)
        ));
    }

    public Optional<GameStats> getStats(String userId, String guildId, GameSource source) {
        return jdbcTemplate.query(
            "SELECT " + STATS_COLUMNS + " FROM game_stats WHERE user_id = ? AND guild_id = ? AND game_source = ?",
            statsRowMapper(),
            userId, guildId, source.dbValue()
        ).stream().findFirst();
    }

    public List<GameStats> getAllStats(String userId, String guildId) {
        return jdbcTemplate.query(
            "SELECT " + STATS_COLUMNS + " FROM game_stats WHERE user_id = ? AND guild_id = ? " +
            "ORDER BY games_played DESC, game_source",
            statsRowMapper(),
            userId, guildId
        );
    }

    public WrappedStats getWrappedStats(String userId, String guildId) {
        List<GameStats> perGame = getAllStats(userId, guildId);

        int played = perGame.stream().mapToInt(GameStats::getGamesPlayed).sum();
        int won = perGame.stream().mapToInt(GameStats::getGamesWon).sum();
        int lost = perGame.stream().mapToInt(GameStats::getGamesLost).sum();
        int bestStreak = perGame.stream().mapToInt(GameStats::getBestWinStreak).max().orElse(0);
        int worstStreak = perGame.stream().mapToInt(GameStats::getWorstLosingStreak).max().orElse(0);
        GameSource favorite = perGame.stream()
                .filter(stats -> stats.getGamesPlayed() > 0)
                .findFirst()
                .map(GameStats::getSource)
                .orElse(null);

        LedgerTotals totals = jdbcTemplate.queryForObject(
            "SELECT " +
            "COALESCE(SUM(CASE WHEN amount < 0 THEN -amount ELSE 0 END), 0) AS wagered, " +
            "COALESCE(SUM(CASE WHEN amount > 0 AND game_source NOT IN " + NON_GAME_SOURCES + " THEN amount ELSE 0 END), 0) AS winnings, " +
            "COALESCE(MAX(CASE WHEN game_source NOT IN " + NON_GAME_SOURCES + " THEN amount END), 0) AS biggest_win, " +
            "COALESCE(MIN(CASE WHEN game_source NOT IN " + NON_GAME_SOURCES + " THEN amount END), 0) AS biggest_loss " +
            "FROM transactions WHERE user_id = ? AND guild_id = ?",
            (rs, rowNum) -> new LedgerTotals(
                rs.getLong("wagered"),
                rs.getLong("winnings"),
                rs.getLong("biggest_win"),
                rs.getLong("biggest_loss")
            ),
            userId, guildId
        );

        BigDecimal winRate = played == 0
                ? BigDecimal.ZERO.setScale(2)
                : BigDecimal.valueOf(won * 100L).divide(BigDecimal.valueOf(played), 2, RoundingMode.HALF_UP);

        return WrappedStats.builder()
                .totalGamesPlayed(played)
                .totalGamesWon(won)
                .totalGamesLost(lost)
                .bestWinStreak(bestStreak)
                .worstLosingStreak(worstStreak)
                .totalWagered(totals.wagered)
                .totalWinnings(totals.winnings)
                .netProfit(totals.winnings - totals.wagered)
                .winRatePercent(winRate)
                .favoriteGame(favorite)
                .biggestWin(Math.max(0L, totals.biggestWin))
                .biggestLoss(Math.max(0L, -totals.biggestLoss))
                .build();
    }

    private String toJson(ExtraCounters extra) {
        try {
            return objectMapper.writeValueAsString(extra == null ? ExtraCounters.empty() : extra);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize extra counters", e);
        }
    }

    private ExtraCounters parseCounters(String json) {
        if (json == null) {
            return ExtraCounters.empty();
        }
        try {
            return objectMapper.readValue(json, ExtraCounters.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt extra stats: " + json, e);
        }
    }

    private RowMapper<GameStats> statsRowMapper() {
        return (rs, rowNum) -> new GameStats(
            rs.getString("user_id"),
            rs.getString("guild_id"),
            GameSource.fromDbValue(rs.getString("game_source")),
            rs.getInt("games_played"),
            rs.getInt("games_won"),
            rs.getInt("games_lost"),
            rs.getInt("current_win_streak"),
            rs.getInt("current_losing_streak"),
            rs.getInt("best_win_streak"),
            rs.getInt("worst_losing_streak"),
            rs.getLong("highest_bet"),
            rs.getLong("highest_payout"),
            rs.getLong("highest_loss"),
            parseCounters(rs.getString("extra_stats"))
        );
    }

    private record LedgerTotals(long wagered, long winnings, long biggestWin, long biggestLoss) {}
}
