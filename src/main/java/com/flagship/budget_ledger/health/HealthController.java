package com.flagship.budget_ledger.health;

import com.flagship.budget_ledger.recurrence.HorizonService;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness/readiness endpoint. Reports the database and how far the
 * recurring series are currently known to be expanded.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final HorizonService horizonService;

    public HealthController(DataSource dataSource, HorizonService horizonService) {
        this.dataSource = dataSource;
        this.horizonService = horizonService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("horizonMonths", horizonService.getHorizonMonths());
        response.put("generatedThrough",
            horizonService.cachedHorizon().map(Object::toString).orElse("unknown"));

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
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
