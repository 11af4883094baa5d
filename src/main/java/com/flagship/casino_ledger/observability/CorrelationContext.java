package com.flagship.casino_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local correlation id plus the MDC keys every log line of a player
 * action carries.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String GUILD_ID_MDC_KEY = "guildId";
    public static final String USER_ID_MDC_KEY = "userId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /** Short form keeps log lines readable. */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Runs {@code work} with the player's ids in the MDC and restores the
     * previous values afterwards, so nested calls keep the outer player.
     */
    public static <T> T withPlayer(String userId, String guildId, Supplier<T> work) {
        String previousUser = MDC.get(USER_ID_MDC_KEY);
        String previousGuild = MDC.get(GUILD_ID_MDC_KEY);
        MDC.put(USER_ID_MDC_KEY, userId);
        MDC.put(GUILD_ID_MDC_KEY, guildId);
        try {
            return work.get();
        } finally {
            restore(USER_ID_MDC_KEY, previousUser);
            restore(GUILD_ID_MDC_KEY, previousGuild);
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }
}
