package com.flagship.live_event_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics this service produces to.
 *
 * live-events carries outbox facts keyed by event ID. realtime carries
 * room broadcasts for the websocket tier, keyed by room.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.live-events:live-events}")
    private String liveEventsTopic;

    @Value("${kafka.topic.realtime:realtime-broadcasts}")
    private String realtimeTopic;

    @Bean
    public NewTopic liveEventsTopic() {
        return TopicBuilder.name(liveEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic realtimeTopic() {
        return TopicBuilder.name(realtimeTopic)
                .partitions(6)
                .replicas(1)
                .build();
    }
}
