package com.flagship.live_event_ledger.health;

import com.flagship.live_event_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness/readiness probe. Ready means the ledger database
 * answers; the outbox backlog is reported but does not fail the probe.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final OutboxMetrics outboxMetrics;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseUp();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", databaseUp ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());
        response.put("database", databaseUp ? "UP" : "DOWN");
        response.put("outboxBacklog", outboxMetrics.getBacklogSize());

        return databaseUp
                ? ResponseEntity.ok(response)
                : ResponseEntity.status(503).body(response);
    }

    private boolean databaseUp() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Health probe could not reach the database: {}", e.getMessage());
            return false;
        }
    }
}
