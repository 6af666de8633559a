package com.flagship.live_event_ledger.outbox;

import com.flagship.live_event_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Polls the outbox and publishes pending events to Kafka.
 *
 * The aggregate ID is the record key so every fact about one event lands on
 * the same partition in commit order. Sends are synchronous; a failed send
 * increments the retry count and an event that reaches
 * {@code outbox.publisher.max-retries} is left for an operator.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.live-events:live-events}")
    private String liveEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getAggregateId().toString(), event.getPayload())
                    .get();

            log.debug("Published outbox event: id={}, topic={}, partition={}, offset={}, type={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (Exception e) {
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        log.error("Failed to publish outbox event: id={}, type={}, error={}",
                event.getId(), event.getEventType(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        int retries = outboxService.markFailed(event.getId(), error);
        if (retries >= maxRetries) {
            log.error("Outbox event {} dead-lettered after {} attempts: type={}, aggregateId={}",
                    event.getId(), retries, event.getEventType(), event.getAggregateId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    private String topicFor(OutboxEvent event) {
        return switch (event.getAggregateType()) {
            case "LiveEvent" -> liveEventsTopic;
            default -> {
                log.warn("No topic mapped for aggregate type {}, using {}", event.getAggregateType(), liveEventsTopic);
                yield liveEventsTopic;
            }
        };
    }
}
