package com.flagship.casino_ledger.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.casino_ledger.api.dto.AdjustBalanceRequest;
import com.flagship.casino_ledger.api.dto.LoanRequest;
import com.flagship.casino_ledger.api.dto.WagerRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.random.RandomGenerator;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface: status codes and error bodies for the outcomes a player can hit.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class CasinoApiTest {

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
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RandomGenerator random;

    private String guildId;
    private String userId;

    @BeforeEach
    void setUp() {
        guildId = "guild-" + UUID.randomUUID().toString().substring(0, 8);
        userId = "user-" + UUID.randomUUID().toString().substring(0, 8);
        when(random.nextInt(anyInt())).thenReturn(0);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private String player(String path) {
        return "/api/guilds/" + guildId + "/players/" + userId + path;
    }

    private ResultActions postJson(String url, Object body) throws Exception {
        return mockMvc.perform(post(url)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    @Nested
    @DisplayName("Wallet")
    class Wallet {

        @Test
        @DisplayName("A first look at the wallet opens it with the starting balance")
        void testOpenWallet() throws Exception {
            mockMvc.perform(get(player("/wallet")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.balance").value(10_000))
                    .andExpect(jsonPath("$.userId").value(userId));
        }

        @Test
        @DisplayName("Admin adjustments return 201 with the new balance")
        void testAdjustment() throws Exception {
            postJson(player("/wallet/adjustments"), new AdjustBalanceRequest(-2_500, "chargeback"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.balance").value(7_500));

            mockMvc.perform(get(player("/wallet/history")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[1].amount").value(-2_500));
        }

        @Test
        @DisplayName("A zero adjustment is a bad request")
        void testZeroAdjustment() throws Exception {
            postJson(player("/wallet/adjustments"), new AdjustBalanceRequest(0, "noop"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid Request"));
        }

        @Test
        @DisplayName("Begging with coins in the wallet is refused")
        void testBegRefused() throws Exception {
            mockMvc.perform(post(player("/beg")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid Request"));
        }

        @Test
        @DisplayName("The fourth loan inside the window answers 429 with Retry-After")
        void testLoanRateLimit() throws Exception {
            printTestHeader("Loan Rate Limit");
            String receiver = "recv-" + UUID.randomUUID().toString().substring(0, 8);

            for (int i = 0; i < 3; i++) {
                postJson(player("/loans"), new LoanRequest(receiver, 100))
                        .andExpect(status().isCreated());
            }

            String body = postJson(player("/loans"), new LoanRequest(receiver, 100))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(header().string("Retry-After", "3600"))
                    .andExpect(jsonPath("$.error").value("Rate Limited"))
                    .andReturn().getResponse().getContentAsString();
            printOutput("Response", body);
        }

        @Test
        @DisplayName("A loan without a receiver fails validation")
        void testLoanValidation() throws Exception {
            postJson(player("/loans"), new LoanRequest("", 100))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Validation Failed"))
                    .andExpect(jsonPath("$.details.receiverId").exists());
        }
    }

    @Nested
    @DisplayName("Games")
    class Games {

        @Test
        @DisplayName("Dealing answers 201 and a second deal conflicts")
        void testDealConflict() throws Exception {
            printTestHeader("Blackjack Deal Conflict");

            postJson(player("/blackjack"), new WagerRequest(100))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.phase").value("PLAYER_TURN"))
                    .andExpect(jsonPath("$.dealerCards[1]").value("??"));

            postJson(player("/blackjack"), new WagerRequest(100))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("Game Already Active"));

            mockMvc.perform(get(player("/blackjack")))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("Acting without a table conflicts and reading it is 404")
        void testNoTable() throws Exception {
            mockMvc.perform(post(player("/blackjack/hit")))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("No Active Game"));

            mockMvc.perform(get(player("/blackjack")))
                    .andExpect(status().isNotFound());
            mockMvc.perform(get(player("/roulette")))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("Bets below the table minimum are bad requests")
        void testBelowMinimum() throws Exception {
            postJson(player("/ride-the-bus"), new WagerRequest(10))
                    .andExpect(status().isBadRequest());

            postJson(player("/slots/spin"), new WagerRequest(0))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Validation Failed"));
        }

        @Test
        @DisplayName("A bet the wallet cannot cover is 422 with the balance in the details")
        void testInsufficientFunds() throws Exception {
            printTestHeader("Insufficient Funds");
            postJson(player("/wallet/adjustments"), new AdjustBalanceRequest(-9_990, "drain"))
                    .andExpect(status().isCreated());

            postJson(player("/slots/spin"), new WagerRequest(100))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value("Insufficient Funds"))
                    .andExpect(jsonPath("$.details.balance").value("10"))
                    .andExpect(jsonPath("$.details.requested").value("100"));

            mockMvc.perform(get(player("/wallet")))
                    .andExpect(jsonPath("$.balance").value(10));
        }

        @Test
        @DisplayName("Opening and cancelling an empty roulette table")
        void testRouletteCancel() throws Exception {
            mockMvc.perform(post(player("/roulette")))
                    .andExpect(status().isCreated());

            mockMvc.perform(delete(player("/roulette")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.balance").value(10_000));
        }

        @Test
        @DisplayName("A fresh guild shows the seeded jackpot")
        void testJackpot() throws Exception {
            mockMvc.perform(get("/api/guilds/" + guildId + "/jackpot"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.amount").value(5_000_000));
        }
    }

    @Nested
    @DisplayName("Stats")
    class Stats {

        @Test
        @DisplayName("No games played is 404, an unknown game is 400")
        void testStatsLookup() throws Exception {
            mockMvc.perform(get(player("/stats/blackjack")))
                    .andExpect(status().isNotFound());

            mockMvc.perform(get(player("/stats/poker")))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Wrapped stats are empty before the first game")
        void testEmptyWrapped() throws Exception {
            mockMvc.perform(get(player("/stats/wrapped")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalGamesPlayed").value(0));
        }
    }
}
