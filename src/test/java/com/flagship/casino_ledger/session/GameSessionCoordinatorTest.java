package com.flagship.casino_ledger.session;

import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.LedgerEntry;
import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Session lifecycle and crash recovery.
 *
 * Abandoned sessions are simulated by backdating created_at past the crash
 * threshold (interaction timeout plus safety margin).
 */
@SpringBootTest
@Testcontainers
class GameSessionCoordinatorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("casino_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("casino.leaderboard.cache.enabled", () -> "false");
    }

    @Autowired
    private GameSessionCoordinator sessions;

    @Autowired
    private WalletService walletService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String guildId;
    private String userId;

    @BeforeEach
    void setUp() {
        guildId = "guild-" + UUID.randomUUID().toString().substring(0, 8);
        userId = "user-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void backdate(GameSource source, int minutes) {
        jdbcTemplate.update(
            "UPDATE game_sessions SET created_at = NOW() - make_interval(mins => ?) " +
            "WHERE user_id = ? AND guild_id = ? AND game_source = ?",
            minutes, userId, guildId, source.dbValue());
    }

    /** Debits the stake and arms the session, the way a game does. */
    private GameSession startWithBet(GameSource source, long bet) {
        walletService.placeBet(userId, guildId, bet, source, Map.of());
        return sessions.start(userId, guildId, source, bet, Map.of("round", 1));
    }

    @Test
    @DisplayName("Only one active session per player and game")
    void testSingleActiveSession() {
        printTestHeader("Single Active Session");

        sessions.start(userId, guildId, GameSource.BLACKJACK, 100, Map.of());

        assertThrows(GameAlreadyActiveException.class,
                () -> sessions.start(userId, guildId, GameSource.BLACKJACK, 100, Map.of()));

        // A different game is independent
        assertDoesNotThrow(() -> sessions.start(userId, guildId, GameSource.SLOTS, 100, Map.of()));
        printSuccess("Second start of the same game rejected");
    }

    @Test
    @DisplayName("A finished session can be started again")
    void testRestartAfterFinish() {
        GameSession first = sessions.start(userId, guildId, GameSource.ROULETTE, 0, Map.of());
        assertTrue(sessions.finish(userId, guildId, GameSource.ROULETTE));
        assertFalse(sessions.finish(userId, guildId, GameSource.ROULETTE), "Finishing twice is a no-op");

        GameSession second = sessions.start(userId, guildId, GameSource.ROULETTE, 50, Map.of());

        assertEquals(first.getSessionId(), second.getSessionId(), "The row is re-armed in place");
        assertEquals(SessionStatus.ACTIVE, second.getStatus());
        assertEquals(50, second.getBetAmount());
    }

    @Test
    @DisplayName("Concurrent starts arm exactly one session")
    void testConcurrentStarts() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger started = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    go.await();
                    sessions.start(userId, guildId, GameSource.SLOTS, 10, Map.of());
                    started.incrementAndGet();
                } catch (GameAlreadyActiveException e) {
                    rejected.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    done.countDown();
                }
            });
        }
        go.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, started.get());
        assertEquals(threads - 1, rejected.get());
    }

    @Test
    @DisplayName("Updating a session that is not active fails")
    void testUpdateWithoutActiveSession() {
        assertThrows(NoActiveGameException.class,
                () -> sessions.updateState(userId, guildId, GameSource.BLACKJACK, Map.of(), 100));
    }

    @Test
    @DisplayName("A fresh session is not treated as crashed")
    void testFreshSessionNotRecovered() {
        startWithBet(GameSource.BLACKJACK, 500);

        Optional<CrashRecord> record = sessions.checkAndRecover(userId, guildId, GameSource.BLACKJACK);

        assertTrue(record.isEmpty());
        assertTrue(sessions.hasActiveGame(userId, guildId, GameSource.BLACKJACK));
        assertEquals(9_500, walletService.getBalance(userId, guildId));
    }

    @Test
    @DisplayName("An abandoned session is crashed and its stake refunded")
    void testAbandonedSessionRefunded() {
        printTestHeader("Crash Refund");

        // Given: a 500 coin blackjack hand abandoned 10 minutes ago
        startWithBet(GameSource.BLACKJACK, 500);
        sessions.updateState(userId, guildId, GameSource.BLACKJACK, Map.of("round", 2), 1_000);
        walletService.placeBet(userId, guildId, 500, GameSource.BLACKJACK, Map.of("choice", "double"));
        backdate(GameSource.BLACKJACK, 10);

        // When
        Optional<CrashRecord> record = sessions.checkAndRecover(userId, guildId, GameSource.BLACKJACK);
        printOutput("Crash record", record);

        // Then: the whole amount at risk comes back
        assertTrue(record.isPresent());
        assertEquals(1_000, record.get().getRefundAmount());
        assertTrue(record.get().getDurationSeconds() >= 600);
        assertEquals(10_000, walletService.getBalance(userId, guildId));

        LedgerEntry refund = walletService.getRecentTransactions(userId, guildId, 1).get(0);
        assertEquals(UpdateKind.CRASH_REFUND, refund.getKind());
        assertEquals(GameSource.BLACKJACK, refund.getSource());

        GameSession session = sessions.getSession(userId, guildId, GameSource.BLACKJACK).orElseThrow();
        assertEquals(SessionStatus.CRASHED, session.getStatus());
        assertEquals(1_000L, session.getRefundAmount());
        assertFalse(sessions.hasActiveGame(userId, guildId, GameSource.BLACKJACK));
        printSuccess("Stake refunded and session marked crashed");
    }

    @Test
    @DisplayName("Racing recoveries refund exactly once")
    void testRefundExactlyOnce() throws Exception {
        printTestHeader("Crash Refund Exactly Once");

        startWithBet(GameSource.SLOTS, 800);
        backdate(GameSource.SLOTS, 30);

        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger recovered = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    go.await();
                    if (sessions.checkAndRecover(userId, guildId, GameSource.SLOTS).isPresent()) {
                        recovered.incrementAndGet();
                    }
                } catch (Exception e) {
                    System.out.println("Unexpected: " + e);
                } finally {
                    done.countDown();
                }
            });
        }
        go.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();
        printOutput("Recoveries", recovered.get());

        assertEquals(1, recovered.get());
        assertEquals(10_000, walletService.getBalance(userId, guildId));
        assertEquals(1, sessions.getCrashHistory(userId, guildId, 10).size());
        printSuccess("One refund, one crash record");
    }

    @Test
    @DisplayName("A crash with nothing at risk writes no ledger entry")
    void testZeroStakeCrash() {
        walletService.getAccount(userId, guildId);
        sessions.start(userId, guildId, GameSource.ROULETTE, 0, Map.of());
        backdate(GameSource.ROULETTE, 10);

        Optional<CrashRecord> record = sessions.checkAndRecover(userId, guildId, GameSource.ROULETTE);

        assertTrue(record.isPresent());
        assertEquals(0, record.get().getRefundAmount());
        List<LedgerEntry> entries = walletService.getRecentTransactions(userId, guildId, 10);
        assertEquals(1, entries.size(), "Only the opening entry should exist");
    }

    @Test
    @DisplayName("Pruning drops old finished sessions and keeps active ones")
    void testPruneOldGames() {
        sessions.start(userId, guildId, GameSource.SLOTS, 0, Map.of());
        sessions.finish(userId, guildId, GameSource.SLOTS);
        sessions.start(userId, guildId, GameSource.BLACKJACK, 0, Map.of());
        jdbcTemplate.update(
            "UPDATE game_sessions SET updated_at = NOW() - INTERVAL '30 days' WHERE user_id = ? AND guild_id = ?",
            userId, guildId);

        int pruned = sessions.pruneOldGames(7);

        assertTrue(pruned >= 1);
        assertTrue(sessions.getSession(userId, guildId, GameSource.SLOTS).isEmpty());
        assertTrue(sessions.hasActiveGame(userId, guildId, GameSource.BLACKJACK));
    }
}
