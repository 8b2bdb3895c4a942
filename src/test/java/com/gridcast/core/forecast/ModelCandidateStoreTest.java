package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ModelCandidateStoreTest {

    private ModelCandidateStore store;

    @BeforeEach
    void setUp() {
        store = new ModelCandidateStore(2);
    }

    static ModelCandidate candidate(String id, String target, ModelKind kind) {
        Instant now = Instant.parse("2025-01-10T00:00:00Z");
        return new ModelCandidate(id, target, kind, now.minus(Duration.ofDays(7)), now, Duration.ofHours(1), now,
                Map.of(), Map.of(), mock(FittedModel.class));
    }

    @Test
    @DisplayName("keeps the most recent N candidates per kind")
    void retention() {
        var first = candidate("SEAS-0001", "ontario_demand", ModelKind.SEASONAL_DECOMPOSITION);
        store.add(first);
        store.add(candidate("SEAS-0002", "ontario_demand", ModelKind.SEASONAL_DECOMPOSITION));
        var evicted = store.add(candidate("SEAS-0003", "ontario_demand", ModelKind.SEASONAL_DECOMPOSITION));
        store.add(candidate("AR-0004", "ontario_demand", ModelKind.AUTOREGRESSIVE));

        assertEquals(List.of(first), evicted);
        assertFalse(store.contains(first));
        assertEquals(3, store.candidates("ontario_demand").size());
        assertEquals("SEAS-0003", store.latest("ontario_demand", ModelKind.SEASONAL_DECOMPOSITION).orElseThrow().id());
    }

    @Test
    @DisplayName("evicting the selected candidate clears the selection")
    void evictionClearsSelection() {
        var first = candidate("NAIVE-0001", "ontario_demand", ModelKind.NAIVE_BASELINE);
        store.add(first);
        store.select(first);
        assertEquals(first, store.selected("ontario_demand").orElseThrow());

        store.add(candidate("NAIVE-0002", "ontario_demand", ModelKind.NAIVE_BASELINE));
        store.add(candidate("NAIVE-0003", "ontario_demand", ModelKind.NAIVE_BASELINE));

        assertTrue(store.selected("ontario_demand").isEmpty());
    }

    @Test
    @DisplayName("latestPerKind follows kind order and targets are isolated")
    void latestPerKind() {
        store.add(candidate("NAIVE-0001", "ontario_demand", ModelKind.NAIVE_BASELINE));
        store.add(candidate("SEAS-0002", "ontario_demand", ModelKind.SEASONAL_DECOMPOSITION));
        store.add(candidate("SEAS-0003", "market_demand", ModelKind.SEASONAL_DECOMPOSITION));

        var latest = store.latestPerKind("ontario_demand");
        assertEquals(List.of("SEAS-0002", "NAIVE-0001"), latest.stream().map(ModelCandidate::id).toList());
        assertEquals(Set.of("market_demand", "ontario_demand"), store.targets());
        assertTrue(store.find("market_demand", "NAIVE-0001").isEmpty());
        assertTrue(store.latestPerKind("zonal_demand:east").isEmpty());
    }

    @Test
    @DisplayName("retention must be positive")
    void invalidRetention() {
        assertThrows(IllegalArgumentException.class, () -> new ModelCandidateStore(0));
    }
}
