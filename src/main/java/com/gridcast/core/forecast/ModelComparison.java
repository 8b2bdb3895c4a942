package com.gridcast.core.forecast;

import java.util.List;

/**
 * Candidates of every kind that trained, best first.
 */
public record ModelComparison(
    String target,
    String primaryMetric,
    List<ModelCandidate> ranked,
    List<ForecastAttempt> attempts
) {

    public ModelComparison {
        ranked = List.copyOf(ranked);
        attempts = List.copyOf(attempts);
    }

    public ModelCandidate best() {
        return ranked.get(0);
    }
}
