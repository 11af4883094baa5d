package com.flagship.casino_ledger.rank;

import com.flagship.casino_ledger.common.UnitOfWork;
import com.flagship.casino_ledger.config.CasinoProperties;
import com.flagship.casino_ledger.ledger.BalanceResolvedEvent;
import com.flagship.casino_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Leaderboards, and the projection of "who is richest" onto the guild's
 * richest-member role.
 *
 * The last known richest member lives in {@code guild_settings}; a change is
 * detected by a guarded update there and announced through the outbox, so
 * the role adapter hears about it exactly when the change committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankProjector {

    private static final int MAX_PAGE = 100;

    private final JdbcTemplate jdbcTemplate;
    private final GuildSettingsService guildSettings;
    private final OutboxService outboxService;
    private final LeaderboardCache cache;
    private final UnitOfWork unitOfWork;
    private final CasinoProperties properties;
    private final Clock clock;

    public List<RankedUser> getTopUsers(String guildId, Integer limit) {
        int size = limit == null
                ? properties.getLeaderboard().getDefaultSize()
                : Math.max(1, Math.min(MAX_PAGE, limit));

        Optional<List<RankedUser>> cached = cache.get(guildId, size);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<RankedUser> page = jdbcTemplate.query(
            "SELECT ROW_NUMBER() OVER (ORDER BY balance DESC, user_id ASC) AS rank, user_id, balance " +
            "FROM users WHERE guild_id = ? AND balance > 0 " +
            "ORDER BY balance DESC, user_id ASC LIMIT ?",
            rankedUserMapper(),
            guildId, size
        );
        cache.put(guildId, size, page);
        return page;
    }

    /**
     * Position among players with a positive balance, empty when unranked.
     */
    public Optional<RankedUser> getUserRank(String userId, String guildId) {
        return jdbcTemplate.query(
            "SELECT rank, user_id, balance FROM (" +
            "  SELECT ROW_NUMBER() OVER (ORDER BY balance DESC, user_id ASC) AS rank, user_id, balance " +
            "  FROM users WHERE guild_id = ? AND balance > 0" +
            ") ranked WHERE user_id = ?",
            rankedUserMapper(),
            guildId, userId
        ).stream().findFirst();
    }

    public Optional<RankedUser> getRichestMember(String guildId) {
        return jdbcTemplate.query(
            "SELECT 1 AS rank, user_id, balance FROM users " +
            "WHERE guild_id = ? AND balance > 0 ORDER BY balance DESC, user_id ASC LIMIT 1",
            rankedUserMapper(),
            guildId
        ).stream().findFirst();
    }

    public GuildSettings configureRichestRole(String guildId, String roleId) {
        GuildSettings settings = guildSettings.configureRichestRole(guildId, roleId);
        if (settings.hasRichestRole()) {
            reconcileRichest(guildId);
        }
        return settings;
    }

    /**
     * Runs after every committed resolved balance change. Rank projection is
     * best effort: a failure here never reaches the player whose game caused it.
     */
    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBalanceResolved(BalanceResolvedEvent event) {
        try {
            reconcileRichest(event.getGuildId());
        } catch (Exception e) {
            log.warn("Richest member projection failed: guildId={}, userId={}, error={}",
                    event.getGuildId(), event.getUserId(), e.getMessage());
        }
    }

    /**
     * Compares the current richest member with the recorded one and, when it
     * changed, records the new holder and queues a {@link RichestMemberChangedEvent}.
     *
     * The settings row is locked before the richest member is read, so
     * concurrent reconciles run one after the other and each one sees the
     * balances the previous one committed against.
     */
    public Optional<RichestMemberChangedEvent> reconcileRichest(String guildId) {
        Optional<GuildSettings> settings = guildSettings.getSettings(guildId);
        if (settings.isEmpty() || !settings.get().hasRichestRole()) {
            return Optional.empty();
        }

        return unitOfWork.execute("rank.reconcile", () -> guildSettings.lockSettings(guildId)
            .filter(GuildSettings::hasRichestRole)
            .flatMap(locked -> getRichestMember(guildId)
                .flatMap(richest -> guildSettings.recordRichestMember(guildId, richest.getUserId())
                    .map(change -> {
                        RichestMemberChangedEvent changed = RichestMemberChangedEvent.of(guildId,
                                locked.getRichestMemberRoleId(), change.getPreviousMemberId(),
                                change.getNewMemberId(), richest.getBalance(), clock.instant());
                        outboxService.saveEvent(RichestMemberChangedEvent.AGGREGATE_TYPE, guildId,
                                RichestMemberChangedEvent.EVENT_TYPE, changed);
                        cache.evict(guildId);
                        log.info("Richest member changed: guildId={}, from={}, to={}, balance={}",
                                guildId, change.getPreviousMemberId(), change.getNewMemberId(),
                                richest.getBalance());
                        return changed;
                    }))));
    }

    private RowMapper<RankedUser> rankedUserMapper() {
        return (rs, rowNum) -> new RankedUser(
            rs.getInt("rank"),
            rs.getString("user_id"),
            rs.getLong("balance")
        );
    }
}
