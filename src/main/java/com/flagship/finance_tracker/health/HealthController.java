package com.flagship.finance_tracker.health;

import com.flagship.finance_tracker.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness/readiness probe.
 * The service is DOWN without its database; the outbox backlog is
 * informational.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final OutboxMetrics outboxMetrics;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean dbHealthy = checkDatabase();

        response.put("status", dbHealthy ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("outboxBacklog", outboxMetrics.getBacklogSize());

        return dbHealthy
            ? ResponseEntity.ok(response)
            : ResponseEntity.status(503).body(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
