package com.gridcast.core.forecast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gridcast.core.model.ModelKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A trained model instance with its training window and evaluation metrics.
 * <p>
 * Metrics are computed on a holdout segment before the final refit; an empty map means
 * the series was too short to hold anything out.
 *
 * @param id          unique candidate id, e.g. {@code AR-0007}
 * @param target      forecasting target key
 * @param kind        model kind
 * @param windowStart timestamp of the first training point
 * @param windowEnd   timestamp of the last training point
 * @param step        spacing between points
 * @param trainedAt   when the candidate was produced
 * @param parameters  fitted parameters, for reporting
 * @param metrics     evaluation metrics keyed by metric name
 * @param model       the fitted model itself
 */
public record ModelCandidate(
    String id,
    String target,
    ModelKind kind,
    @JsonProperty("window_start") Instant windowStart,
    @JsonProperty("window_end") Instant windowEnd,
    Duration step,
    @JsonProperty("trained_at") Instant trainedAt,
    Map<String, Object> parameters,
    Map<String, Double> metrics,
    @JsonIgnore FittedModel model
) {

    public ModelCandidate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(model, "model");
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public ModelCandidate withMetrics(Map<String, Double> newMetrics) {
        return new ModelCandidate(id, target, kind, windowStart, windowEnd, step, trainedAt,
                parameters, newMetrics, model);
    }

    /**
     * Value of a metric, or {@link Double#NaN} if it was not computed.
     */
    public double metric(String name) {
        Double value = metrics.get(name);
        return value != null ? value : Double.NaN;
    }

    /**
     * Compact view for capability results and the reasoning context.
     */
    public Map<String, Object> describe() {
        var map = new LinkedHashMap<String, Object>();
        map.put("candidate_id", id);
        map.put("target", target);
        map.put("kind", kind.name());
        map.put("window_start", windowStart != null ? windowStart.toString() : null);
        map.put("window_end", windowEnd != null ? windowEnd.toString() : null);
        map.put("trained_at", trainedAt != null ? trainedAt.toString() : null);
        map.put("metrics", metrics);
        return map;
    }
}
