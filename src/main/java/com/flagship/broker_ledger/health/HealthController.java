package com.flagship.broker_ledger.health;

import com.flagship.broker_ledger.outbox.OutboxService;
import com.flagship.broker_ledger.snapshot.SnapshotStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness check. Unlike the actuator endpoint it needs no
 * authorization. Reports the open episode count and outbox backlog next
 * to the database status; only the database decides UP or DOWN.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final SnapshotStore snapshotStore;
    private final OutboxService outboxService;

    public HealthController(DataSource dataSource, SnapshotStore snapshotStore, OutboxService outboxService) {
        this.dataSource = dataSource;
        this.snapshotStore = snapshotStore;
        this.outboxService = outboxService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("openEpisodes", snapshotStore.findAllActive().size());
        response.put("outboxBacklog", outboxService.countUnpublished());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
