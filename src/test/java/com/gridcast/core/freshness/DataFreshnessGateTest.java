package com.gridcast.core.freshness;

import com.gridcast.core.model.FreshnessVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DataFreshnessGateTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final DataFreshnessGate gate = new DataFreshnessGate();
    private final FreshnessPolicy hourly = FreshnessPolicy.hourly();

    @Test
    @DisplayName("two hours old hourly data is stale")
    void twoHoursIsStale() {
        var verdict = gate.checkFreshness(NOW.minus(Duration.ofHours(2)), NOW, hourly);

        assertEquals(FreshnessVerdict.Verdict.STALE, verdict.verdict());
        assertTrue(verdict.isStale());
        assertEquals(Duration.ofMinutes(90), verdict.threshold());
        assertEquals(2.0, verdict.hoursOld());
    }

    @Test
    @DisplayName("thirty minutes old hourly data is fresh")
    void thirtyMinutesIsFresh() {
        var verdict = gate.checkFreshness(NOW.minus(Duration.ofMinutes(30)), NOW, hourly);

        assertEquals(FreshnessVerdict.Verdict.FRESH, verdict.verdict());
        assertEquals(Duration.ofMinutes(30), verdict.staleness());
    }

    @Test
    @DisplayName("staleness exactly at the threshold is still fresh")
    void thresholdIsInclusive() {
        assertFalse(gate.checkFreshness(NOW.minus(Duration.ofMinutes(90)), NOW, hourly).isStale());
        assertTrue(gate.checkFreshness(NOW.minus(Duration.ofMinutes(90)).minusMillis(1), NOW, hourly).isStale());
    }

    @Test
    @DisplayName("future timestamps count as zero staleness")
    void futureTimestamp() {
        var verdict = gate.checkFreshness(NOW.plus(Duration.ofHours(1)), NOW, hourly);
        assertEquals(Duration.ZERO, verdict.staleness());
        assertFalse(verdict.isStale());
    }

    @Test
    @DisplayName("policy comes from configuration")
    void policyFromProperties() {
        var properties = new FreshnessProperties();
        properties.setExpectedIntervalMinutes(15);
        properties.setStalenessMultiplier(2.0);

        assertEquals(Duration.ofMinutes(30), properties.toPolicy().threshold());
        assertThrows(IllegalArgumentException.class, () -> new FreshnessPolicy(Duration.ZERO, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new FreshnessPolicy(Duration.ofHours(1), 0));
    }
}
