package com.flagship.casino_ledger.config;

import com.flagship.casino_ledger.ledger.GameSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Tunables of the casino economy, bound from the {@code casino.*} block.
 */
@ConfigurationProperties(prefix = "casino")
@Validated
@Getter
@Setter
public class CasinoProperties {

    @Min(0)
    private long startingBalance = 10_000;

    @Min(1)
    private long minBet = 50;

    /** Maximum bet per game, keyed by the persisted game source name. */
    private Map<String, Long> betLimits = new HashMap<>();

    @Valid
    private final Beg beg = new Beg();
    @Valid
    private final Loan loan = new Loan();
    @Valid
    private final Session session = new Session();
    @Valid
    private final Storage storage = new Storage();
    @Valid
    private final Jackpot jackpot = new Jackpot();
    @Valid
    private final History history = new History();
    @Valid
    private final Roulette roulette = new Roulette();
    @Valid
    private final Leaderboard leaderboard = new Leaderboard();

    public long maxBetFor(GameSource source) {
        Long limit = betLimits.get(source.dbValue());
        if (limit == null) {
            throw new IllegalStateException("No bet limit configured for " + source.dbValue());
        }
        return limit;
    }

    @Getter
    @Setter
    public static class Beg {
        @Min(1)
        private long minAmount = 500;
        @Min(1)
        private long maxAmount = 1000;
    }

    @Getter
    @Setter
    public static class Loan {
        @Min(1)
        private int maxPerWindow = 3;
        @NotNull
        private Duration window = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class Session {
        @NotNull
        private Duration interactionTimeout = Duration.ofMinutes(3);
        @NotNull
        private Duration safetyMargin = Duration.ofMinutes(1);
        @Min(1)
        private int retentionDays = 7;
        @NotBlank
        private String pruneCron = "0 0 4 * * *";

        /**
         * Age after which an active session counts as abandoned.
         */
        public Duration crashThreshold() {
            return interactionTimeout.plus(safetyMargin);
        }
    }

    @Getter
    @Setter
    public static class Storage {
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration backoff = Duration.ofMillis(50);
    }

    @Getter
    @Setter
    public static class Jackpot {
        @Min(0)
        private long seed = 5_000_000;
        /** Fraction of each slots bet fed into the pool; 1.0 is the whole bet. */
        @DecimalMin("0.0")
        private BigDecimal contributionRate = BigDecimal.ONE;
    }

    @Getter
    @Setter
    public static class History {
        private int defaultSize = 100;
        private int minSize = 2;
        private int maxSize = 1000;

        public int clamp(Integer requested) {
            int size = requested == null ? defaultSize : requested;
            return Math.max(minSize, Math.min(maxSize, size));
        }
    }

    @Getter
    @Setter
    public static class Roulette {
        @Min(1)
        private int maxBetsPerSpin = 30;
    }

    @Getter
    @Setter
    public static class Leaderboard {
        @Min(1)
        private int defaultSize = 10;
        @Valid
        private final Cache cache = new Cache();

        @Getter
        @Setter
        public static class Cache {
            private boolean enabled = true;
            @NotNull
            private Duration ttl = Duration.ofSeconds(30);
        }
    }
}
