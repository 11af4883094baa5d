package com.flagship.casino_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.casino_ledger.rank.RichestMemberChangedEvent;
import com.flagship.casino_ledger.rank.RoleAssignmentPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Applies guild rank events to the chat platform's roles.
 *
 * Offsets are acknowledged only after the event is handled (or recognised as
 * a duplicate); anything that cannot even be parsed is acknowledged and
 * dropped, since redelivering it would fail the same way.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RankEventConsumer {

    static final String CONSUMER_GROUP = "casino-rank-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final RoleAssignmentPort roleAssignmentPort;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.rank:casino-rank}",
        groupId = "${spring.kafka.consumer.group-id:casino-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse rank event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        boolean processed = route(envelope, record.value());
        ack.acknowledge();

        if (processed) {
            log.info("Processed event: type={}, eventId={}, guildId={}",
                    envelope.eventType, envelope.eventId, envelope.guildId);
        }
    }

    private boolean route(EventEnvelope envelope, String rawPayload) {
        if (RichestMemberChangedEvent.EVENT_TYPE.equals(envelope.eventType)) {
            return eventProcessor.processEvent(
                envelope.eventId, envelope.eventType,
                RichestMemberChangedEvent.AGGREGATE_TYPE, envelope.guildId,
                CONSUMER_GROUP,
                () -> {
                    RichestMemberChangedEvent event = deserialize(rawPayload, RichestMemberChangedEvent.class);
                    roleAssignmentPort.transferRole(event.getGuildId(), event.getRoleId(),
                            event.getPreviousMemberId(), event.getNewMemberId());
                }
            );
        }

        log.debug("Unknown event type: {}, skipping", envelope.eventType);
        eventProcessor.skipEvent(envelope.eventId, envelope.eventType,
                RichestMemberChangedEvent.AGGREGATE_TYPE, envelope.guildId,
                CONSUMER_GROUP, "Unknown event type");
        return false;
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            String guildId = node.get("guildId").asText();
            String eventType = node.has("eventType") ? node.get("eventType").asText() : "Unknown";
            return new EventEnvelope(eventId, guildId, eventType);
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize event: " + e.getMessage(), e);
        }
    }

    private record EventEnvelope(UUID eventId, String guildId, String eventType) {}
}
