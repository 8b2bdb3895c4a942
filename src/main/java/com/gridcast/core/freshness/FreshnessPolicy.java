package com.gridcast.core.freshness;

import java.time.Duration;

/**
 * Staleness policy: data is stale once it is older than
 * {@code expectedInterval * multiplier}.
 *
 * @param expectedInterval cadence at which new data points are expected to arrive
 * @param multiplier       tolerance factor applied to the expected interval
 */
public record FreshnessPolicy(Duration expectedInterval, double multiplier) {

    public FreshnessPolicy {
        if (expectedInterval == null || expectedInterval.isNegative() || expectedInterval.isZero()) {
            throw new IllegalArgumentException("expectedInterval must be positive");
        }
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be positive");
        }
    }

    public static FreshnessPolicy hourly() {
        return new FreshnessPolicy(Duration.ofHours(1), 1.5);
    }

    public Duration threshold() {
        return Duration.ofMillis(Math.round(expectedInterval.toMillis() * multiplier));
    }
}
