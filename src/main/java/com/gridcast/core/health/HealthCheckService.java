package com.gridcast.core.health;

import com.gridcast.core.capability.CapabilityRegistry;
import com.gridcast.core.data.DataSourceException;
import com.gridcast.core.data.DemandDataSource;
import com.gridcast.core.freshness.DataFreshnessGate;
import com.gridcast.core.freshness.FreshnessProperties;
import com.gridcast.core.llm.LlmProperties;
import com.gridcast.core.model.FreshnessVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CapabilityRegistry registry;
    private final DataSource dataSource;
    private final DemandDataSource demandDataSource;
    private final DataFreshnessGate freshnessGate;
    private final FreshnessProperties freshnessProperties;
    private final LlmProperties llmProperties;
    private final Clock clock;

    public HealthCheckService(
            CapabilityRegistry registry,
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) DemandDataSource demandDataSource,
            DataFreshnessGate freshnessGate,
            FreshnessProperties freshnessProperties,
            LlmProperties llmProperties,
            Clock clock) {
        this.registry = registry;
        this.dataSource = dataSource;
        this.demandDataSource = demandDataSource;
        this.freshnessGate = freshnessGate;
        this.freshnessProperties = freshnessProperties;
        this.llmProperties = llmProperties;
        this.clock = clock;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRegistry());
        results.add(checkDatabase());
        results.add(checkDataFreshness());
        results.add(checkLlm());
        return results;
    }

    /**
     * DOWN if any component is down, DEGRADED if any is degraded, UP otherwise.
     */
    public static HealthStatus.Status overall(List<HealthStatus> checks) {
        boolean degraded = false;
        for (var check : checks) {
            if (check.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            degraded |= check.status() == HealthStatus.Status.DEGRADED;
        }
        return degraded ? HealthStatus.Status.DEGRADED : HealthStatus.Status.UP;
    }

    private HealthStatus checkRegistry() {
        if (registry.size() > 0) {
            return new HealthStatus("capabilities", HealthStatus.Status.UP,
                    registry.size() + " capabilities registered", Map.of());
        }
        return new HealthStatus("capabilities", HealthStatus.Status.DOWN,
                "No capabilities registered", Map.of());
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkDataFreshness() {
        if (demandDataSource == null) {
            return new HealthStatus("demand-data", HealthStatus.Status.DOWN,
                    "No demand data source configured", Map.of());
        }
        try {
            var latest = demandDataSource.latestTimestamp();
            if (latest.isEmpty()) {
                return new HealthStatus("demand-data", HealthStatus.Status.DOWN,
                        "Demand store is empty", Map.of());
            }
            FreshnessVerdict verdict = freshnessGate.checkFreshness(latest.get(), clock.instant(),
                    freshnessProperties.toPolicy());
            var metadata = Map.of("latest", latest.get().toString(), "hoursOld", String.valueOf(verdict.hoursOld()));
            if (verdict.isStale()) {
                return new HealthStatus("demand-data", HealthStatus.Status.DEGRADED,
                        "Data is stale (" + verdict.hoursOld() + "h old)", metadata);
            }
            return new HealthStatus("demand-data", HealthStatus.Status.UP, "Data is fresh", metadata);
        } catch (DataSourceException e) {
            log.warn("Demand data health check failed: {}", e.getMessage());
            return new HealthStatus("demand-data", HealthStatus.Status.DOWN,
                    "Demand data error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkLlm() {
        if (llmProperties.hasModel()) {
            return new HealthStatus("reasoning-model", HealthStatus.Status.UP,
                    "Model configured: " + llmProperties.getModel(),
                    Map.of("provider", String.valueOf(llmProperties.getProvider())));
        }
        return new HealthStatus("reasoning-model", HealthStatus.Status.DEGRADED,
                "No reasoning model configured", Map.of("provider", String.valueOf(llmProperties.getProvider())));
    }
}
