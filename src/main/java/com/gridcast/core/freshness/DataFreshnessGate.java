package com.gridcast.core.freshness;

import com.gridcast.core.model.FreshnessVerdict;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Decides whether the newest known data point is recent enough to act on.
 * Pure: no clock, no I/O.
 */
@Component
public class DataFreshnessGate {

    /**
     * @param latestKnownTimestamp newest data point reported by the data source
     * @param now                  reference time
     * @param policy               staleness policy
     * @return {@code STALE} if the staleness strictly exceeds the policy threshold, otherwise {@code FRESH}
     */
    public FreshnessVerdict checkFreshness(Instant latestKnownTimestamp, Instant now, FreshnessPolicy policy) {
        Objects.requireNonNull(latestKnownTimestamp, "latestKnownTimestamp");
        Objects.requireNonNull(now, "now");
        Objects.requireNonNull(policy, "policy");

        Duration staleness = Duration.between(latestKnownTimestamp, now);
        // timestamps ahead of the reference clock count as zero staleness
        if (staleness.isNegative()) {
            staleness = Duration.ZERO;
        }
        Duration threshold = policy.threshold();
        var verdict = staleness.compareTo(threshold) > 0
                ? FreshnessVerdict.Verdict.STALE
                : FreshnessVerdict.Verdict.FRESH;
        return new FreshnessVerdict(latestKnownTimestamp, staleness, threshold, verdict);
    }
}
