package com.flagship.casino_ledger.game.blackjack;

import com.flagship.casino_ledger.common.InvalidWagerException;
import com.flagship.casino_ledger.game.BonusFlag;
import com.flagship.casino_ledger.game.OutcomeKind;
import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.session.GameAlreadyActiveException;
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

import java.util.List;
import java.util.UUID;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

/**
 * Blackjack against the database with a pinned shuffle.
 *
 * With every random draw returning 0 the deck deals 2♥ A♠ to the player and
 * K♠ Q♠ to the dealer, followed by J♠ and 10♠.
 */
@SpringBootTest
@Testcontainers
class BlackjackServiceTest {

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
    private BlackjackService blackjackService;

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
        when(random.nextInt(anyInt())).thenReturn(0);
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
    @DisplayName("Deal debits the bet and hides the dealer's hole card")
    void testDeal() {
        printTestHeader("Blackjack Deal");

        BlackjackRound round = blackjackService.start(userId, guildId, 500);
        printOutput("Round", round);

        assertEquals(TablePhase.PLAYER_TURN, round.getPhase());
        assertEquals(9_500, round.getBalance());
        assertEquals(List.of("K♠", BlackjackRound.HIDDEN_CARD), round.getDealerCards());
        assertNull(round.getDealerValue());
        assertTrue(round.isCanDouble());
        assertFalse(round.isCanSplit());
        assertTrue(sessions.hasActiveGame(userId, guildId, GameSource.BLACKJACK));
        printSuccess("Bet taken, round waiting on the player");
    }

    @Test
    @DisplayName("Standing on 13 against 20 loses the bet and closes the session")
    void testStandAndLose() {
        blackjackService.start(userId, guildId, 500);

        BlackjackRound round = blackjackService.stand(userId, guildId);

        assertEquals(TablePhase.RESOLVED, round.getPhase());
        assertEquals(20, round.getDealerValue());
        assertEquals(OutcomeKind.LOSS, round.getOutcomes().get(0).getKind());
        assertEquals(9_500, walletService.getBalance(userId, guildId));
        assertFalse(sessions.hasActiveGame(userId, guildId, GameSource.BLACKJACK));

        GameStats stats = statsService.getStats(userId, guildId, GameSource.BLACKJACK).orElseThrow();
        assertEquals(1, stats.getGamesLost());
        assertEquals(500, stats.getHighestLoss());
    }

    @Test
    @DisplayName("Hit keeps the round open and the deck survives the snapshot")
    void testHitKeepsRoundOpen() {
        blackjackService.start(userId, guildId, 200);

        BlackjackRound round = blackjackService.hit(userId, guildId);

        assertEquals(TablePhase.PLAYER_TURN, round.getPhase());
        assertEquals(13, round.getHands().get(0).getValue());
        assertEquals(3, round.getHands().get(0).getCards().size());

        BlackjackRound reloaded = blackjackService.getTable(userId, guildId).orElseThrow();
        assertEquals(round.getHands().get(0).getCards(), reloaded.getHands().get(0).getCards());
    }

    @Test
    @DisplayName("Double down takes a second stake and records the doubled loss")
    void testDoubleDown() {
        printTestHeader("Double Down");
        blackjackService.start(userId, guildId, 300);

        BlackjackRound round = blackjackService.doubleDown(userId, guildId);
        printOutput("Round", round);

        assertEquals(TablePhase.RESOLVED, round.getPhase());
        assertTrue(round.getOutcomes().get(0).has(BonusFlag.DOUBLED));
        assertEquals(600, round.getOutcomes().get(0).getWager());
        assertEquals(10_000 - 600, walletService.getBalance(userId, guildId));

        GameStats stats = statsService.getStats(userId, guildId, GameSource.BLACKJACK).orElseThrow();
        assertEquals(1, stats.getExtraStats().get("double_down_losses"));
        printSuccess("Both stakes lost, counter recorded");
    }

    @Test
    @DisplayName("Splitting an unequal pair is rejected and costs nothing")
    void testInvalidSplit() {
        blackjackService.start(userId, guildId, 300);

        assertThrows(InvalidWagerException.class, () -> blackjackService.split(userId, guildId));
        assertEquals(9_700, walletService.getBalance(userId, guildId));
        assertTrue(sessions.hasActiveGame(userId, guildId, GameSource.BLACKJACK));
    }

    @Test
    @DisplayName("A second deal while a hand is open is rejected without a debit")
    void testSecondDealRejected() {
        blackjackService.start(userId, guildId, 300);

        assertThrows(GameAlreadyActiveException.class, () -> blackjackService.start(userId, guildId, 300));
        assertEquals(9_700, walletService.getBalance(userId, guildId));
    }

    @Test
    @DisplayName("Acting without a hand fails")
    void testActWithoutHand() {
        assertThrows(NoActiveGameException.class, () -> blackjackService.hit(userId, guildId));
        assertTrue(blackjackService.getTable(userId, guildId).isEmpty());
    }

    @Test
    @DisplayName("Bets below the minimum are rejected")
    void testMinimumBet() {
        assertThrows(InvalidWagerException.class, () -> blackjackService.start(userId, guildId, 10));
        assertEquals(10_000, walletService.getBalance(userId, guildId));
    }

    @Test
    @DisplayName("An abandoned hand is refunded before the next deal")
    void testAbandonedHandRefundedOnNextDeal() {
        printTestHeader("Abandoned Hand Refund");
        blackjackService.start(userId, guildId, 1_000);
        blackjackService.hit(userId, guildId);
        jdbcTemplate.update(
            "UPDATE game_sessions SET created_at = NOW() - INTERVAL '10 minutes' WHERE user_id = ? AND guild_id = ?",
            userId, guildId);

        BlackjackRound round = blackjackService.start(userId, guildId, 400);

        assertEquals(10_000 - 400, round.getBalance(), "Old stake refunded, new stake taken");
        assertEquals(1, sessions.getCrashHistory(userId, guildId, 10).size());
        printSuccess("Crash refunded and a new hand dealt");
    }
}
