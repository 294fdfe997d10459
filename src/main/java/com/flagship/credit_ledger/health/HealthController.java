package com.flagship.credit_ledger.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe that only needs the ledger database. Unlike the actuator endpoint it
 * needs no authorization and ignores optional dependencies such as Redis and Kafka.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final Clock clock;

    public HealthController(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ledgerDatabaseUp = checkDatabase();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", ledgerDatabaseUp ? "UP" : "DOWN");
        response.put("timestamp", clock.instant().toString());
        response.put("ledgerDatabase", ledgerDatabaseUp ? "UP" : "DOWN");

        return ledgerDatabaseUp
            ? ResponseEntity.ok(response)
            : ResponseEntity.status(503).body(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
