package com.gridcast.core.capability.builtin;

import com.gridcast.core.capability.CapabilityArguments;
import com.gridcast.core.capability.InvocationContext;
import com.gridcast.core.data.DemandFixtures;
import com.gridcast.core.decisionlog.InMemoryDecisionLedger;
import com.gridcast.core.forecast.ForecastModelManager;
import com.gridcast.core.forecast.ForecastProperties;
import com.gridcast.core.forecast.ModelCandidateStore;
import com.gridcast.core.metrics.AgentMetrics;
import com.gridcast.core.model.AgentPhase;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.ModelKind;
import com.gridcast.core.model.SessionStatus;
import com.gridcast.core.model.SessionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntrospectionCapabilitiesTest {

    private static final Instant T0 = Instant.parse("2025-02-01T00:00:00Z");

    private final InMemoryDecisionLedger ledger = new InMemoryDecisionLedger();
    private final ForecastProperties properties = new ForecastProperties();
    private final ForecastModelManager manager = new ForecastModelManager(properties,
            new ModelCandidateStore(properties), new AgentMetrics(new SimpleMeterRegistry()),
            Clock.fixed(T0, ZoneOffset.UTC));
    private final IntrospectionCapabilities capabilities = new IntrospectionCapabilities(ledger, manager);
    private final InvocationContext ctx = new InvocationContext("GRID-5", "inv-1", "get_performance_history");

    private void outcome(String id, SessionStatus status, ErrorKind kind) {
        ledger.appendOutcome(new SessionSummary(id, "Forecast tomorrow", status,
                status == SessionStatus.SUCCEEDED ? AgentPhase.DONE : AgentPhase.FAILED,
                "reason", kind, 2, null, T0, T0.plusSeconds(30), List.of()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> dataOf(Object data) {
        return (Map<String, Object>) data;
    }

    @Test
    @DisplayName("reports recent sessions newest first, limited")
    void recentSessions() {
        outcome("GRID-1", SessionStatus.SUCCEEDED, null);
        outcome("GRID-2", SessionStatus.FAILED, ErrorKind.NO_DATA);
        outcome("GRID-3", SessionStatus.SUCCEEDED, null);

        var result = capabilities.performanceHistory(new CapabilityArguments(Map.of("limit", 2)), ctx);

        assertTrue(result.success());
        @SuppressWarnings("unchecked")
        var sessions = (List<Map<String, Object>>) dataOf(result.data()).get("sessions");
        assertEquals(2, sessions.size());
        assertEquals("GRID-3", sessions.get(0).get("session_id"));
        assertEquals("NO_DATA", sessions.get(1).get("error_kind"));
        assertTrue(result.message().startsWith("2 recent session(s), 1 succeeded"));
    }

    @Test
    @DisplayName("includes the latest metrics of each trained model")
    void modelMetrics() {
        manager.train("ontario_demand", DemandFixtures.hourly(200), ModelKind.NAIVE_BASELINE, () -> true);

        var result = capabilities.performanceHistory(CapabilityArguments.empty(), ctx);

        var models = dataOf(dataOf(result.data()).get("models"));
        assertEquals(List.of("ontario_demand"), List.copyOf(models.keySet()));
        var perKind = dataOf(models.get("ontario_demand"));
        assertTrue(perKind.containsKey("NAIVE_BASELINE"));
    }

    @Test
    @DisplayName("an empty ledger is still a successful answer")
    void empty() {
        var result = capabilities.performanceHistory(CapabilityArguments.empty(), ctx);

        assertTrue(result.success());
        assertTrue(((List<?>) dataOf(result.data()).get("sessions")).isEmpty());
    }
}
