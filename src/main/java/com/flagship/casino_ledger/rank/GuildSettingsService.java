package com.flagship.casino_ledger.rank;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class GuildSettingsService {

    private final JdbcTemplate jdbcTemplate;

    public Optional<GuildSettings> getSettings(String guildId) {
        return jdbcTemplate.query(
            "SELECT guild_id, guild_name, richest_member_role_id, richest_member_id " +
            "FROM guild_settings WHERE guild_id = ?",
            settingsRowMapper(),
            guildId
        ).stream().findFirst();
    }

    /**
     * Loads the settings under a row lock held until the caller's transaction
     * ends. Must run inside a transaction.
     */
    public Optional<GuildSettings> lockSettings(String guildId) {
        return jdbcTemplate.query(
            "SELECT guild_id, guild_name, richest_member_role_id, richest_member_id " +
            "FROM guild_settings WHERE guild_id = ? FOR UPDATE",
            settingsRowMapper(),
            guildId
        ).stream().findFirst();
    }

    /**
     * Sets (or clears, with a null role) the role handed to the richest member.
     */
    public GuildSettings configureRichestRole(String guildId, String roleId) {
        jdbcTemplate.update(
            "INSERT INTO guild_settings (guild_id, richest_member_role_id) VALUES (?, ?) " +
            "ON CONFLICT (guild_id) DO UPDATE SET richest_member_role_id = EXCLUDED.richest_member_role_id, " +
            "updated_at = NOW()",
            guildId, roleId
        );
        log.info("Richest member role configured: guildId={}, roleId={}", guildId, roleId);
        return getSettings(guildId).orElseThrow();
    }

    /**
     * Records the new richest member if it differs from the stored one.
     *
     * @return the handover, empty when the stored member was already this one
     */
    public Optional<RichestChange> recordRichestMember(String guildId, String memberId) {
        return jdbcTemplate.query(
            "WITH old AS (SELECT richest_member_id FROM guild_settings WHERE guild_id = ? FOR UPDATE) " +
            "UPDATE guild_settings SET richest_member_id = ?, updated_at = NOW() FROM old " +
            "WHERE guild_settings.guild_id = ? AND guild_settings.richest_member_id IS DISTINCT FROM ? " +
            "RETURNING old.richest_member_id",
            (rs, rowNum) -> new RichestChange(rs.getString(1), memberId),
            guildId, memberId, guildId, memberId
        ).stream().findFirst();
    }

    private RowMapper<GuildSettings> settingsRowMapper() {
        return (rs, rowNum) -> new GuildSettings(
            rs.getString("guild_id"),
            rs.getString("guild_name"),
            rs.getString("richest_member_role_id"),
            rs.getString("richest_member_id")
        );
    }
}
