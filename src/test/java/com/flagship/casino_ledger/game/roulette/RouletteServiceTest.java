package com.flagship.casino_ledger.game.roulette;

import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.LedgerEntry;
import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.session.GameSessionCoordinator;
import com.flagship.casino_ledger.session.NoActiveGameException;
import com.flagship.casino_ledger.stats.GameStats;
import com.flagship.casino_ledger.stats.StatsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

/**
 * Roulette table lifecycle with the wheel pinned to 17 (black, odd, low).
 */
@SpringBootTest
@Testcontainers
class RouletteServiceTest {

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

    @MockBean
    private RandomGenerator random;

    @Autowired
    private RouletteService rouletteService;

    @Autowired
    private WalletService walletService;

    @Autowired
    private StatsService statsService;

    @Autowired
    private GameSessionCoordinator sessions;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String guildId;
    private String userId;

    @BeforeEach
    void setUp() {
        when(random.nextInt(anyInt())).thenReturn(17);
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

    @Test
    @DisplayName("Every bet on the felt is settled on its own")
    void testSpinSettlesEachBet() {
        printTestHeader("Roulette Spin");

        // Given: straight 17, red and odd
        rouletteService.openTable(userId, guildId);
        rouletteService.placeBet(userId, guildId, RouletteBetType.STRAIGHT, "17", 100);
        rouletteService.placeBet(userId, guildId, RouletteBetType.RED, null, 50);
        RouletteView view = rouletteService.placeBet(userId, guildId, RouletteBetType.ODD, null, 50);
        assertEquals(200, view.getTotalWagered());
        assertEquals(9_800, view.getBalance());

        // When
        RouletteSpinResult result = rouletteService.spin(userId, guildId);
        printOutput("Result", result);

        // Then: straight pays 3,600, odd pays 100, red loses
        assertEquals("17", result.getPocket());
        assertEquals(PocketColor.BLACK, result.getColor());
        assertEquals(3_700, result.getTotalPayout());
        assertEquals(10_000 - 200 + 3_700, result.getBalance());
        assertFalse(sessions.hasActiveGame(userId, guildId, GameSource.ROULETTE));

        GameStats stats = statsService.getStats(userId, guildId, GameSource.ROULETTE).orElseThrow();
        assertEquals(1, stats.getGamesPlayed());
        assertEquals(1, stats.getGamesWon());
        assertEquals(1, stats.getExtraStats().get("wheel_black"));
        assertEquals(1, stats.getExtraStats().get("straight_wins"));
        assertEquals(1, stats.getExtraStats().get("bet_red_losses"));
        assertEquals(1, stats.getExtraStats().get("bet_odd_wins"));
        printSuccess("Each bet settled independently");
    }

    @Test
    @DisplayName("A spin where every bet misses is one lost game")
    void testAllBetsLose() {
        rouletteService.openTable(userId, guildId);
        rouletteService.placeBet(userId, guildId, RouletteBetType.EVEN, null, 100);
        rouletteService.placeBet(userId, guildId, RouletteBetType.HIGH, null, 100);

        RouletteSpinResult result = rouletteService.spin(userId, guildId);

        assertEquals(0, result.getTotalPayout());
        assertEquals(9_800, walletService.getBalance(userId, guildId));
        GameStats stats = statsService.getStats(userId, guildId, GameSource.ROULETTE).orElseThrow();
        assertEquals(1, stats.getGamesLost());
    }

    @Test
    @DisplayName("Cancelling refunds every chip and closes the table")
    void testCancelRefunds() {
        rouletteService.openTable(userId, guildId);
        rouletteService.placeBet(userId, guildId, RouletteBetType.RED, null, 100);
        rouletteService.placeBet(userId, guildId, RouletteBetType.STRAIGHT, "5", 250);

        long balance = rouletteService.cancel(userId, guildId);

        assertEquals(10_000, balance);
        assertFalse(sessions.hasActiveGame(userId, guildId, GameSource.ROULETTE));
        LedgerEntry refund = walletService.getRecentTransactions(userId, guildId, 1).get(0);
        assertEquals(UpdateKind.REFUND, refund.getKind());
        assertEquals(350, refund.getAmount());
    }

    @Test
    @DisplayName("Clearing bets refunds them but keeps the table open")
    void testClearBets() {
        rouletteService.openTable(userId, guildId);
        rouletteService.placeBet(userId, guildId, RouletteBetType.BLACK, null, 100);

        RouletteView view = rouletteService.clearBets(userId, guildId);

        assertTrue(view.getBets().isEmpty());
        assertEquals(10_000, view.getBalance());
        assertTrue(rouletteService.getTable(userId, guildId).isPresent());
        assertThrows(InvalidWagerException.class, () -> rouletteService.spin(userId, guildId));
    }

    @Test
    @DisplayName("A rejected bet costs nothing")
    void testDuplicateBetRejected() {
        rouletteService.openTable(userId, guildId);
        rouletteService.placeBet(userId, guildId, RouletteBetType.RED, null, 100);

        assertThrows(InvalidWagerException.class,
                () -> rouletteService.placeBet(userId, guildId, RouletteBetType.RED, null, 100));
        assertEquals(9_900, walletService.getBalance(userId, guildId));
        assertEquals(1, rouletteService.getTable(userId, guildId).orElseThrow().getBets().size());
    }

    @Test
    @DisplayName("Betting without an open table fails")
    void testBetWithoutTable() {
        assertThrows(NoActiveGameException.class,
                () -> rouletteService.placeBet(userId, guildId, RouletteBetType.RED, null, 100));
    }

    @Test
    @DisplayName("An abandoned table is refunded when the player comes back")
    void testAbandonedTableRefunded() {
        rouletteService.openTable(userId, guildId);
        rouletteService.placeBet(userId, guildId, RouletteBetType.RED, null, 400);
        jdbcTemplate.update(
            "UPDATE game_sessions SET created_at = NOW() - INTERVAL '10 minutes' WHERE user_id = ? AND guild_id = ?",
            userId, guildId);

        RouletteView view = rouletteService.openTable(userId, guildId);

        assertEquals(10_000, view.getBalance());
        assertTrue(view.getBets().isEmpty());
        assertEquals(400, sessions.getCrashHistory(userId, guildId, 1).get(0).getRefundAmount());
    }
}
