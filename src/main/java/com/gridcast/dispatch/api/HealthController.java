package com.gridcast.dispatch.api;

import com.gridcast.core.health.HealthCheckService;
import com.gridcast.core.health.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for agent health: capability registry, ledger database,
 * demand data freshness and reasoning model configuration.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health. 200 when nothing is DOWN (overall DEGRADED if any component is), 503 otherwise.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (healthCheckService == null) {
            body.put("status", HealthStatus.Status.DOWN.name());
            body.put("components", Map.of());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        HealthStatus.Status overall = HealthCheckService.overall(checks);

        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            components.put(check.component(), describe(check));
        }
        body.put("status", overall.name());
        body.put("components", components);

        if (overall == HealthStatus.Status.DOWN) {
            log.warn("Health check reports DOWN: {}", checks.stream()
                    .filter(c -> c.status() == HealthStatus.Status.DOWN)
                    .map(HealthStatus::component)
                    .toList());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/v1/health/{component}. Single component, 404 if unknown.
     */
    @GetMapping("/{component}")
    public ResponseEntity<Map<String, Object>> component(@PathVariable String component) {
        if (healthCheckService == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return healthCheckService.checkAll().stream()
                .filter(check -> check.component().equals(component))
                .findFirst()
                .map(check -> ResponseEntity.ok(describe(check)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static Map<String, Object> describe(HealthStatus check) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("status", check.status().name());
        info.put("detail", check.detail());
        if (check.metadata() != null && !check.metadata().isEmpty()) {
            info.put("metadata", check.metadata());
        }
        return info;
    }
}
