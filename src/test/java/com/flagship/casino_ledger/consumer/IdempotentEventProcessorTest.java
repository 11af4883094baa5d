package com.flagship.casino_ledger.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Events handled at most once per consumer, and a failed handler leaves no
 * trace so the redelivery can try again.
 */
@SpringBootTest
@Testcontainers
class IdempotentEventProcessorTest {

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
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "RichestMemberChanged";
    private static final String AGGREGATE_TYPE = "Guild";

    private String guildId;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
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

    @Test
    @DisplayName("First delivery runs the handler and records the event")
    void testFirstDelivery() {
        printTestHeader("First Delivery");
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean processed = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, guildId,
                CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(processed);
        assertEquals(1, calls.get());
        assertTrue(repository.existsByEventIdAndConsumerGroup(eventId, CONSUMER_GROUP));
        printSuccess("Handled and recorded");
    }

    @Test
    @DisplayName("Redelivery of a handled event is ignored")
    void testRedeliveryIgnored() {
        printTestHeader("Redelivery Ignored");
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, guildId, CONSUMER_GROUP, calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, guildId,
                CONSUMER_GROUP, calls::incrementAndGet);

        assertFalse(second);
        assertEquals(1, calls.get(), "The role must not be moved twice");
        assertEquals(1, repository.countByConsumerGroup(CONSUMER_GROUP));
        printSuccess("Duplicate skipped");
    }

    @Test
    @DisplayName("A failing handler is not recorded, so the next delivery retries it")
    void testFailureAllowsRetry() {
        printTestHeader("Failure Allows Retry");
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> eventProcessor.processEvent(
                eventId, EVENT_TYPE, AGGREGATE_TYPE, guildId, CONSUMER_GROUP,
                () -> {
                    calls.incrementAndGet();
                    throw new IllegalStateException("role service unavailable");
                }));
        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        boolean retried = eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, guildId,
                CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(retried);
        assertEquals(2, calls.get());
        printSuccess("Retry went through");
    }

    @Test
    @DisplayName("Skipped events are not looked at again")
    void testSkippedEvent() {
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.skipEvent(eventId, "SomethingElse", AGGREGATE_TYPE, guildId, CONSUMER_GROUP, "Unknown event type");
        boolean processed = eventProcessor.processEvent(eventId, "SomethingElse", AGGREGATE_TYPE, guildId,
                CONSUMER_GROUP, calls::incrementAndGet);

        assertFalse(processed);
        assertEquals(0, calls.get());
    }
}
