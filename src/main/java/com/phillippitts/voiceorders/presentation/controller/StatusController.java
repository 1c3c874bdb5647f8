package com.phillippitts.voiceorders.presentation.controller;

import com.phillippitts.voiceorders.service.orders.OrderDataStore;
import com.phillippitts.voiceorders.service.orders.SnapshotStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service banner and the lightweight health check used by the voice front end.
 *
 * <p>{@code /health} always answers 200; the body tells whether the order snapshot is usable.
 * Operators should prefer {@code /actuator/health}, which also reflects the HTTP status.
 */
@RestController
class StatusController {

    private static final Logger LOG = LogManager.getLogger(StatusController.class);

    private final OrderDataStore orderDataStore;

    StatusController(OrderDataStore orderDataStore) {
        this.orderDataStore = orderDataStore;
    }

    @GetMapping("/")
    ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", "Voice Orders service is running"));
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, String>> health() {
        SnapshotStatus status = orderDataStore.status();
        LOG.debug("Health check: database={}", status.database());
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", status.isHealthy() ? "healthy" : "unhealthy");
        body.put("database", status.database());
        body.put("message", status.message());
        return ResponseEntity.ok(body);
    }
}
