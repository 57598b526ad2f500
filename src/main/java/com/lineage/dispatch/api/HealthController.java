package com.lineage.dispatch.api;

import com.lineage.core.health.HealthCheckService;
import com.lineage.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health and real-time connection statistics.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final HealthCheckService healthCheckService;
    private final ConnectionManager connectionManager;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService,
                            @Autowired(required = false) ConnectionManager connectionManager) {
        this.healthCheckService = healthCheckService;
        this.connectionManager = connectionManager;
    }

    /**
     * GET /api/v1/health: 200 unless a component is DOWN, then 503.
     * A DEGRADED store still answers 200 with the component marked.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> result = new LinkedHashMap<>();

        if (healthCheckService == null) {
            result.put("status", "DOWN");
            result.put("components", Map.of());
            return ResponseEntity.status(503).body(result);
        }

        boolean anyDown = false;
        boolean anyDegraded = false;
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : healthCheckService.checkAll()) {
            Map<String, Object> componentInfo = new LinkedHashMap<>();
            componentInfo.put("status", check.status().name());
            componentInfo.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                componentInfo.put("metadata", check.metadata());
            }
            components.put(check.component(), componentInfo);

            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }

        result.put("status", anyDown ? "DOWN" : anyDegraded ? "DEGRADED" : "UP");
        result.put("components", components);
        return anyDown ? ResponseEntity.status(503).body(result) : ResponseEntity.ok(result);
    }

    @GetMapping("/realtime/stats")
    public ResponseEntity<Map<String, Integer>> realtimeStats() {
        if (connectionManager == null) {
            return ResponseEntity.status(503).build();
        }
        return ResponseEntity.ok(connectionManager.getConnectionStats());
    }
}
