package com.gridcast.core.capability.builtin;

import com.gridcast.core.capability.CapabilityArguments;
import com.gridcast.core.capability.InvocationContext;
import com.gridcast.core.data.DemandDataProperties;
import com.gridcast.core.data.DemandDataSource;
import com.gridcast.core.data.DemandFixtures;
import com.gridcast.core.forecast.ForecastModelManager;
import com.gridcast.core.forecast.ForecastProperties;
import com.gridcast.core.forecast.ModelCandidateStore;
import com.gridcast.core.freshness.DataFreshnessGate;
import com.gridcast.core.freshness.FreshnessProperties;
import com.gridcast.core.metrics.AgentMetrics;
import com.gridcast.core.model.ErrorKind;
import com.gridcast.core.model.ForecastResult;
import com.gridcast.core.model.ModelKind;
import com.gridcast.core.model.SeriesPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ForecastCapabilitiesTest {

    private static final List<SeriesPoint> SERIES = DemandFixtures.hourly(200);
    private static final Instant LATEST = SERIES.get(SERIES.size() - 1).timestamp();

    private ForecastProperties forecastProperties;
    private ForecastModelManager manager;

    @BeforeEach
    void setUp() {
        forecastProperties = new ForecastProperties();
        manager = new ForecastModelManager(forecastProperties, new ModelCandidateStore(forecastProperties),
                new AgentMetrics(new SimpleMeterRegistry()), Clock.fixed(LATEST, ZoneOffset.UTC));
    }

    private ForecastCapabilities capabilities(DemandDataSource source, Instant now) {
        return new ForecastCapabilities(manager, source, new DemandDataProperties(), forecastProperties,
                new DataFreshnessGate(), new FreshnessProperties(), Clock.fixed(now, ZoneOffset.UTC));
    }

    private ForecastCapabilities fresh() {
        return capabilities(DemandFixtures.source(SERIES), LATEST.plus(Duration.ofMinutes(20)));
    }

    private static InvocationContext context() {
        return new InvocationContext("GRID-1", "inv-1", "produce_forecast");
    }

    @Test
    @DisplayName("produce_forecast returns a ForecastResult of the requested horizon")
    void produceForecast() {
        var result = fresh().produceForecast(new CapabilityArguments(Map.of("horizon", 24)), context());

        assertTrue(result.success(), result.message());
        var forecast = (ForecastResult) result.data();
        assertEquals(24, forecast.horizon());
        assertEquals(24, forecast.points().size());
        assertEquals(LATEST.plus(Duration.ofHours(1)), forecast.points().get(0).timestamp());
        assertEquals("FALLBACK", result.metadata().get("strategy"));
        assertEquals("FRESH", result.metadata().get("freshness"));
        assertEquals(200, result.metadata().get("training_points"));
    }

    @Test
    @DisplayName("stale data only annotates the forecast unless freshness is required")
    void staleData() {
        var stale = capabilities(DemandFixtures.source(SERIES), LATEST.plus(Duration.ofHours(6)));

        var annotated = stale.produceForecast(new CapabilityArguments(Map.of("horizon", 12)), context());
        var strict = stale.produceForecast(
                new CapabilityArguments(Map.of("horizon", 12, "require_fresh", true)), context());

        assertTrue(annotated.success());
        assertEquals(true, annotated.metadata().get("stale"));
        assertFalse(strict.success());
        assertEquals(ErrorKind.STALE_DATA, strict.errorKind());
        assertInstanceOf(ForecastResult.class, strict.data());
    }

    @Test
    @DisplayName("a series shorter than every model's window is NO_MODEL_AVAILABLE")
    void noModelAvailable() {
        var shortSeries = DemandFixtures.hourly(20);
        var caps = capabilities(DemandFixtures.source(shortSeries),
                shortSeries.get(shortSeries.size() - 1).timestamp());

        var result = caps.produceForecast(new CapabilityArguments(Map.of("horizon", 24)), context());

        assertEquals(ErrorKind.NO_MODEL_AVAILABLE, result.errorKind());
        @SuppressWarnings("unchecked")
        var attempts = (List<Map<String, Object>>) result.metadata().get("attempts");
        assertEquals(forecastProperties.getChain().size(), attempts.size());
    }

    @Test
    @DisplayName("training a single kind on too little data is INSUFFICIENT_DATA")
    void trainInsufficient() {
        var shortSeries = DemandFixtures.hourly(30);
        var caps = capabilities(DemandFixtures.source(shortSeries),
                shortSeries.get(shortSeries.size() - 1).timestamp());

        var result = caps.train(new CapabilityArguments(Map.of("kind", "AUTOREGRESSIVE")), context());

        assertEquals(ErrorKind.INSUFFICIENT_DATA, result.errorKind());
        assertEquals(30, result.metadata().get("available_points"));
    }

    @Test
    @DisplayName("train registers a candidate for the target")
    void trainRegisters() {
        var result = fresh().train(new CapabilityArguments(Map.of("kind", "NAIVE_BASELINE")), context());

        assertTrue(result.success(), result.message());
        assertEquals(1, manager.store().candidates("ontario_demand").size());
        assertEquals(ModelKind.NAIVE_BASELINE, manager.store().candidates("ontario_demand").get(0).kind());
    }

    @Test
    @DisplayName("an abandoned invocation stores nothing and reports TIMEOUT")
    void abandoned() {
        var ctx = context();
        ctx.abandon();

        var result = fresh().train(new CapabilityArguments(Map.of("kind", "SEASONAL_DECOMPOSITION")), ctx);

        assertEquals(ErrorKind.TIMEOUT, result.errorKind());
        assertTrue(manager.store().candidates("ontario_demand").isEmpty());
    }

    @Test
    @DisplayName("evaluate_model backtests without registering")
    void evaluate() {
        var result = fresh().evaluate(new CapabilityArguments(Map.of("kind", "SEASONAL_DECOMPOSITION")), context());

        assertTrue(result.success(), result.message());
        @SuppressWarnings("unchecked")
        var data = (Map<String, Object>) result.data();
        assertEquals(24, data.get("holdout_points"));
        assertTrue(manager.store().candidates("ontario_demand").isEmpty());
    }

    @Test
    @DisplayName("compare_models ranks every kind in the chain")
    void compare() {
        var result = fresh().compare(CapabilityArguments.empty(), context());

        assertTrue(result.success(), result.message());
        @SuppressWarnings("unchecked")
        var data = (Map<String, Object>) result.data();
        assertEquals("MAPE", data.get("primary_metric"));
        assertEquals(3, ((List<?>) data.get("ranking")).size());
    }

    @Test
    @DisplayName("an empty store is NO_DATA before any training")
    void emptyStore() {
        var caps = capabilities(DemandFixtures.source(List.of()), LATEST);

        assertEquals(ErrorKind.NO_DATA,
                caps.produceForecast(new CapabilityArguments(Map.of("horizon", 24)), context()).errorKind());
    }
}
