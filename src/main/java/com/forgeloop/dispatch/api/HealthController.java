package com.forgeloop.dispatch.api;

import com.forgeloop.core.health.HealthCheckService;
import com.forgeloop.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 unless a component is DOWN, then 503. DEGRADED still answers 200.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        var checks = healthCheckService.checkAll();
        boolean anyDown = false;
        boolean anyDegraded = false;

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
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

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", anyDown ? "DOWN" : anyDegraded ? "DEGRADED" : "UP");
        result.put("components", components);

        return anyDown ? ResponseEntity.status(503).body(result)
                       : ResponseEntity.ok(result);
    }
}
