package com.flagship.casino_ledger.rank;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.casino_ledger.config.CasinoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Short-lived Redis copy of leaderboard pages. The database stays the source
 * of truth: every Redis failure is a cache miss.
 */
@Component
@Slf4j
public class LeaderboardCache {

    private static final String KEY_PREFIX = "leaderboard:";
    private static final TypeReference<List<RankedUser>> PAGE = new TypeReference<>() { };

    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final CasinoProperties properties;

    public LeaderboardCache(Optional<StringRedisTemplate> redisTemplate,
                            ObjectMapper objectMapper,
                            CasinoProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public Optional<List<RankedUser>> get(String guildId, int limit) {
        if (!enabled()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(key(guildId, limit));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, PAGE));
        } catch (Exception e) {
            log.warn("Leaderboard cache read failed for guild {}, using database: {}", guildId, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String guildId, int limit, List<RankedUser> page) {
        if (!enabled()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(key(guildId, limit), objectMapper.writeValueAsString(page),
                    properties.getLeaderboard().getCache().getTtl());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Leaderboard page is not serializable", e);
        } catch (Exception e) {
            log.debug("Failed to cache leaderboard for guild {}: {}", guildId, e.getMessage());
        }
    }

    public void evict(String guildId) {
        if (!enabled()) {
            return;
        }
        try {
            var keys = redisTemplate.get().keys(KEY_PREFIX + guildId + ":*");
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.get().delete(keys);
            }
        } catch (Exception e) {
            log.warn("Failed to evict leaderboard cache for guild {}: {}", guildId, e.getMessage());
        }
    }

    private boolean enabled() {
        return properties.getLeaderboard().getCache().isEnabled() && redisTemplate.isPresent();
    }

    private static String key(String guildId, int limit) {
        return KEY_PREFIX + guildId + ":" + limit;
    }
}
