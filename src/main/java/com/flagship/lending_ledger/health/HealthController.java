package com.flagship.lending_ledger.health;

import com.flagship.lending_ledger.loan.exception.LendingException;
import com.flagship.lending_ledger.rate.RateOracle;
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
 * Liveness/readiness endpoint for probes, outside the Actuator health tree.
 *
 * The database decides UP or DOWN. A stale rate is reported but keeps the service up:
 * reads and repayments still work without one.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final RateOracle rateOracle;

    public HealthController(DataSource dataSource, RateOracle rateOracle) {
        this.dataSource = dataSource;
        this.rateOracle = rateOracle;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("rates", checkRates() ? "FRESH" : "STALE");

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
            return false;
        }
    }

    private boolean checkRates() {
        try {
            rateOracle.currentRates();
            return true;
        } catch (LendingException e) {
            return false;
        }
    }
}
