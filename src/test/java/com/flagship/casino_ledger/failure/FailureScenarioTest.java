package com.flagship.casino_ledger.failure;

import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.ledger.UpdateKind;
import com.flagship.casino_ledger.ledger.WalletService;
import com.flagship.casino_ledger.outbox.OutboxEvent;
import com.flagship.casino_ledger.outbox.OutboxEventEntity;
import com.flagship.casino_ledger.outbox.OutboxEventRepository;
import com.flagship.casino_ledger.outbox.OutboxPublisher;
import com.flagship.casino_ledger.outbox.OutboxService;
import com.flagship.casino_ledger.rank.RankProjector;
import com.flagship.casino_ledger.rank.RankedUser;
import com.flagship.casino_ledger.rank.RichestMemberChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Failure scenarios around the infrastructure the casino leans on.
 *
 * Redis and Kafka both point at ports nothing listens on. Games and the
 * leaderboard must keep working; outbox events must wait for the broker.
 */
@SpringBootTest
@Testcontainers
class FailureScenarioTest {

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
        registry.add("spring.data.redis.host", () -> "localhost");
        registry.add("spring.data.redis.port", () -> "6399");
        registry.add("casino.leaderboard.cache.enabled", () -> "true");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("spring.kafka.producer.properties.max.block.ms", () -> "1000");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("outbox.publisher.max-retries", () -> "2");
    }

    @Autowired
    private WalletService walletService;

    @Autowired
    private RankProjector rankProjector;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    private String guildId;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        guildId = "guild-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Nested
    @DisplayName("1. Redis Failure Scenarios")
    class RedisFailureTests {

        @Test
        @DisplayName("1.1 Leaderboard reads fall back to the database")
        void testLeaderboardWithoutRedis() {
            printTestHeader("Leaderboard Without Redis");
            String alice = "alice-" + UUID.randomUUID().toString().substring(0, 8);
            String bob = "bob-" + UUID.randomUUID().toString().substring(0, 8);
            walletService.adjustBalance(alice, guildId, 3_000, GameSource.ADMIN,
                    UpdateKind.ADMIN_ADJUSTMENT, Map.of("reason", "test"));
            walletService.getAccount(bob, guildId);

            List<RankedUser> first = rankProjector.getTopUsers(guildId, 10);
            List<RankedUser> second = rankProjector.getTopUsers(guildId, 10);

            assertEquals(2, first.size());
            assertEquals(alice, first.get(0).getUserId());
            assertEquals(first, second);
            printSuccess("Leaderboard served from the database");
        }

        @Test
        @DisplayName("1.2 Balance changes complete while cache eviction fails")
        void testGameplayWithoutRedis() {
            String userId = "user-" + UUID.randomUUID().toString().substring(0, 8);
            rankProjector.configureRichestRole(guildId, "role-1");

            walletService.placeBet(userId, guildId, 500, GameSource.SLOTS, Map.of());
            long balance = walletService.awardWinnings(userId, guildId, 1_500, GameSource.SLOTS, Map.of());

            assertEquals(11_000, balance);
            assertEquals(11_000, walletService.getBalance(userId, guildId));
        }
    }

    @Nested
    @DisplayName("2. Kafka Failure Scenarios")
    class KafkaFailureTests {

        private OutboxEvent saveEvent() {
            RichestMemberChangedEvent payload = RichestMemberChangedEvent.of(
                    guildId, "role-1", null, "user-1", 10_000, Instant.now());
            return transactionTemplate.execute(status -> outboxService.saveEvent(
                    RichestMemberChangedEvent.AGGREGATE_TYPE, guildId,
                    RichestMemberChangedEvent.EVENT_TYPE, payload));
        }

        @Test
        @DisplayName("2.1 Events stay in the outbox when Kafka is unavailable")
        void testEventsRemainPending() {
            printTestHeader("Events Remain Pending");
            OutboxEvent event = saveEvent();

            outboxPublisher.triggerPublish();

            OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
            System.out.println("Retry count: " + entity.getRetryCount() + ", last error: " + entity.getLastError());
            assertNull(entity.getPublishedAt());
            assertEquals(1, entity.getRetryCount());
            assertNotNull(entity.getLastError());
            List<OutboxEvent> pending = outboxService.getEventsForAggregate(
                    RichestMemberChangedEvent.AGGREGATE_TYPE, guildId);
            assertEquals(1, pending.size());
            assertFalse(pending.get(0).isPublished());
            printSuccess("Event kept for a later attempt");
        }

        @Test
        @DisplayName("2.2 After max retries the event is left as a dead letter")
        void testDeadLetter() {
            OutboxEvent event = saveEvent();

            outboxPublisher.triggerPublish();
            outboxPublisher.triggerPublish();
            outboxPublisher.triggerPublish();

            OutboxEventEntity entity = outboxEventRepository.findById(event.getId()).orElseThrow();
            assertEquals(2, entity.getRetryCount(), "No send is attempted past the limit");
            assertNull(entity.getPublishedAt());
        }
    }
}
