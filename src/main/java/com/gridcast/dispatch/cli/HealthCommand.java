package com.gridcast.dispatch.cli;

import com.gridcast.core.health.HealthCheckService;
import com.gridcast.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: gridcast health
 * <p>
 * Runs the health checks and prints one line per component with its metadata (for demand data,
 * the latest timestamp and its age), then the overall verdict. DEGRADED means sessions still run
 * but forecasts may be built on stale data or without a reasoning model. Exits 1 only when a
 * component is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--component", "-c"}, description = "Only check this component (e.g. demand-data)")
    private String component;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        if (component != null) {
            checks = checks.stream().filter(c -> c.component().equals(component)).toList();
            if (checks.isEmpty()) {
                ConsoleOutput.error("Unknown component '" + component + "'");
                return 1;
            }
        }

        for (var check : checks) {
            String label = String.format("%-16s %-9s %s", check.component(), check.status(), check.detail());
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            if (check.metadata() != null && !check.metadata().isEmpty()) {
                System.out.println("    " + describe(check.metadata()));
            }
        }

        System.out.println("──────────────────────────────────");
        HealthStatus.Status overall = HealthCheckService.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: UP, all systems operational");
            case DEGRADED -> ConsoleOutput.warn("Overall: DEGRADED, sessions run but "
                    + componentsIn(checks, HealthStatus.Status.DEGRADED) + " need attention");
            case DOWN -> ConsoleOutput.error("Overall: DOWN, " + componentsIn(checks, HealthStatus.Status.DOWN)
                    + " unavailable");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }

    private static String describe(Map<String, String> metadata) {
        return metadata.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }

    private static String componentsIn(List<HealthStatus> checks, HealthStatus.Status status) {
        return checks.stream()
                .filter(c -> c.status() == status)
                .map(HealthStatus::component)
                .collect(Collectors.joining(", "));
    }
}
