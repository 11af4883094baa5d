package com.flagship.casino_ledger.game.slots;

import com.flagship.casino_ledger.config.CasinoProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Community jackpot pool.
 *
 * The pool is only ever changed by a single SQL statement: contributions add
 * to it in place, a win reads and resets it under one row lock. Nothing reads
 * the amount into memory and writes it back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JackpotService {


    private final JdbcTemplate jdbcTemplate;
    private final CasinoProperties properties;

    public Jackpot getJackpot(String guildId) {
        ensurePool(guildId);
        return jdbcTemplate.queryForObject(
            "SELECT guild_id, amount, last_winner_id, last_won_at, updated_at " +
            "FROM progressive_jackpot WHERE guild_id = ?",
            (rs, rowNum) -> new Jackpot(
                rs.getString("guild_id"),
                rs.getLong("amount"),
                rs.getString("last_winner_id"),
                toInstant(rs.getTimestamp("last_won_at")),
                toInstant(rs.getTimestamp("updated_at"))
            ),
            guildId
        );
    }

    /**
     * Adds the bet's share to the pool.
     *
     * @return the pool after the contribution
     */
    public long contribute(String guildId, long bet) {
        ensurePool(guildId);
        long share = contributionFor(bet);
        Long amount = jdbcTemplate.queryForObject(
            "UPDATE progressive_jackpot SET amount = amount + ?, updated_at = NOW() " +
            "WHERE guild_id = ? RETURNING amount",
            Long.class,
            share, guildId
        );
        log.debug("Jackpot contribution: guildId={}, share={}, pool={}", guildId, share, amount);
        return amount != null ? amount : 0L;
    }

    /**
     * Hands the whole pool to the winner and puts the seed back.
     *
     * @return the amount won
     */
    public long claim(String guildId, String winnerId) {
        ensurePool(guildId);
        Long won = jdbcTemplate.queryForObject(
            "WITH old AS (SELECT amount FROM progressive_jackpot WHERE guild_id = ? FOR UPDATE) " +
            "UPDATE progressive_jackpot SET amount = ?, last_winner_id = ?, last_won_at = NOW(), updated_at = NOW() " +
            "FROM old WHERE progressive_jackpot.guild_id = ? RETURNING old.amount",
            Long.class,
            guildId, properties.getJackpot().getSeed(), winnerId, guildId
        );
        log.info("Jackpot claimed: guildId={}, winner={}, amount={}", guildId, winnerId, won);
        return won != null ? won : 0L;
    }

    public long contributionFor(long bet) {
        long share = BigDecimal.valueOf(bet)
                .multiply(properties.getJackpot().getContributionRate())
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
        return Math.max(share, 1L);
    }

    private void ensurePool(String guildId) {
        jdbcTemplate.update(
            "INSERT INTO progressive_jackpot (guild_id, amount) VALUES (?, ?) ON CONFLICT (guild_id) DO NOTHING",
            guildId, properties.getJackpot().getSeed()
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
