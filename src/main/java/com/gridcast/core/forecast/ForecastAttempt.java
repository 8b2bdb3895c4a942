package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a fallback chain run.
 *
 * @param kind        model kind attempted
 * @param success     whether the kind produced a candidate
 * @param candidateId id of the trained candidate, or {@code null}
 * @param detail      failure reason or short success note
 * @param metrics     holdout metrics of the candidate, empty on failure
 */
public record ForecastAttempt(
    ModelKind kind,
    boolean success,
    String candidateId,
    String detail,
    Map<String, Double> metrics
) {

    public ForecastAttempt {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static ForecastAttempt succeeded(ModelCandidate candidate) {
        return new ForecastAttempt(candidate.kind(), true, candidate.id(), "trained", candidate.metrics());
    }

    public static ForecastAttempt failed(ModelKind kind, String reason) {
        return new ForecastAttempt(kind, false, null, reason, Map.of());
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", kind.name());
        map.put("success", success);
        if (candidateId != null) {
            map.put("candidate_id", candidateId);
        }
        map.put("detail", detail);
        if (!metrics.isEmpty()) {
            map.put("metrics", metrics);
        }
        return map;
    }
}
