package com.flagship.general_ledger.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe that does not need actuator access.
 *
 * Reports DOWN when the database or the migrated ledger schema is unreachable.
 */
@RestController
@Slf4j
public class HealthController {

    private final JdbcTemplate jdbcTemplate;

    public HealthController(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        Long openPeriods = countOpenPeriods();
        response.put("database", openPeriods != null ? "UP" : "DOWN");

        if (openPeriods == null) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("openPeriods", openPeriods);
        return ResponseEntity.ok(response);
    }

    private Long countOpenPeriods() {
        try {
            return jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM fiscal_periods WHERE status = 'OPEN'", Long.class);
        } catch (Exception e) {
            log.warn("Health check database query failed: {}", e.getMessage());
            return null;
        }
    }
}
