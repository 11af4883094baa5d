package com.flagship.casino_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.casino_ledger.config.JacksonConfig;
import com.flagship.casino_ledger.rank.RichestMemberChangedEvent;
import com.flagship.casino_ledger.rank.RoleAssignmentPort;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RankEventConsumerTest {

    private IdempotentEventProcessor eventProcessor;
    private RoleAssignmentPort roleAssignmentPort;
    private Acknowledgment ack;
    private ObjectMapper objectMapper;
    private RankEventConsumer consumer;

    @BeforeEach
    void setUp() {
        eventProcessor = mock(IdempotentEventProcessor.class);
        roleAssignmentPort = mock(RoleAssignmentPort.class);
        ack = mock(Acknowledgment.class);
        objectMapper = new JacksonConfig().objectMapper();
        consumer = new RankEventConsumer(eventProcessor, roleAssignmentPort, objectMapper);

        // Run the handler the way the real processor does on first delivery
        when(eventProcessor.processEvent(any(), anyString(), anyString(), anyString(), anyString(), any()))
                .thenAnswer(invocation -> {
                    Runnable handler = invocation.getArgument(5);
                    handler.run();
                    return true;
                });
    }

    private ConsumerRecord<String, String> record(String key, String value) {
        return new ConsumerRecord<>("casino-rank", 0, 0L, key, value);
    }

    @Test
    @DisplayName("Richest member change moves the role and acknowledges")
    void testRoleTransferred() throws Exception {
        RichestMemberChangedEvent event = RichestMemberChangedEvent.of(
                "guild-1", "role-9", "user-old", "user-new", 50_000, Instant.parse("2026-01-01T00:00:00Z"));
        String json = objectMapper.writeValueAsString(event);

        consumer.consume(record("guild-1", json), ack);

        verify(roleAssignmentPort).transferRole("guild-1", "role-9", "user-old", "user-new");
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unknown event types are skipped and acknowledged")
    void testUnknownTypeSkipped() {
        UUID eventId = UUID.randomUUID();
        String json = "{\"eventId\":\"" + eventId + "\",\"guildId\":\"guild-1\",\"eventType\":\"GuildRenamed\"}";

        consumer.consume(record("guild-1", json), ack);

        verify(eventProcessor).skipEvent(eq(eventId), eq("GuildRenamed"), anyString(), eq("guild-1"),
                anyString(), anyString());
        verifyNoInteractions(roleAssignmentPort);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Garbage payloads are acknowledged and dropped")
    void testUnparseablePayloadDropped() {
        consumer.consume(record("guild-1", "not json"), ack);

        verifyNoInteractions(eventProcessor, roleAssignmentPort);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("A failing role transfer is not acknowledged so it is redelivered")
    void testFailureNotAcknowledged() throws Exception {
        RichestMemberChangedEvent event = RichestMemberChangedEvent.of(
                "guild-1", "role-9", null, "user-new", 50_000, Instant.now());
        doThrow(new IllegalStateException("platform down"))
                .when(roleAssignmentPort).transferRole(anyString(), anyString(), any(), anyString());

        assertThrows(IllegalStateException.class,
                () -> consumer.consume(record("guild-1", objectMapper.writeValueAsString(event)), ack));

        verify(ack, never()).acknowledge();
    }
}
