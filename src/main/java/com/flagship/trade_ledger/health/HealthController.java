package com.flagship.trade_ledger.health;

import com.flagship.trade_ledger.config.LedgerProperties;
import com.flagship.trade_ledger.store.LedgerStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final LedgerStore store;
    private final LedgerProperties properties;

    public HealthController(LedgerStore store, LedgerProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean storeHealthy = checkStore();
        response.put("store", storeHealthy ? "UP" : "DOWN");

        if (!storeHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkStore() {
        try {
            store.get(properties.getKeys().getAccountIndex());
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
