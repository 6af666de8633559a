package com.flagship.live_event_ledger.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes room broadcasts to Kafka for the websocket tier to fan out.
 * The room ID is the record key so a room's messages stay ordered.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KafkaRealtimeBroadcaster implements RealtimeBroadcaster {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topic.realtime:realtime-broadcasts}")
    private String realtimeTopic;

    @Override
    public void broadcast(String roomId, RealtimeMessage message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize broadcast for room {}: {}", roomId, e.getMessage());
            return;
        }

        try {
            kafkaTemplate.send(realtimeTopic, roomId, payload).whenComplete((result, error) -> {
                if (error != null) {
                    log.error("Broadcast to room {} failed: type={}, error={}", roomId, message.getType(), error.getMessage());
                } else {
                    log.debug("Broadcast to room {} delivered: type={}, offset={}",
                            roomId, message.getType(), result.getRecordMetadata().offset());
                }
            });
        } catch (Exception e) {
            log.error("Broadcast to room {} could not be queued: type={}, error={}", roomId, message.getType(), e.getMessage());
        }
    }
}
