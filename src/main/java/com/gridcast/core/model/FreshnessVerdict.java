package com.gridcast.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Result of a freshness check. Recomputed on every PERCEIVE phase and never persisted.
 *
 * @param latestKnownTimestamp most recent data point the source reports
 * @param staleness            time elapsed since that point (never negative)
 * @param threshold            staleness above which data is considered stale
 * @param verdict              fresh or stale
 */
public record FreshnessVerdict(
    @JsonProperty("latest_known_timestamp") Instant latestKnownTimestamp,
    Duration staleness,
    Duration threshold,
    Verdict verdict
) implements Serializable {

    public enum Verdict { FRESH, STALE }

    @JsonIgnore
    public boolean isStale() {
        return verdict == Verdict.STALE;
    }

    /** Staleness in fractional hours, rounded to two decimals. */
    @JsonProperty("hours_old")
    public double hoursOld() {
        return Math.round(staleness.toSeconds() / 36.0) / 100.0;
    }
}
