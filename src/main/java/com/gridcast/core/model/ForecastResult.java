package com.gridcast.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * An immutable forecast produced from exactly one model candidate.
 *
 * @param candidateId id of the candidate that generated the forecast
 * @param kind        model kind of that candidate
 * @param target      forecasting target key (series and zone)
 * @param horizon     number of forecast steps
 * @param points      ordered forecast steps, one per horizon step
 * @param generatedAt when the forecast was produced
 */
public record ForecastResult(
    @JsonProperty("candidate_id") String candidateId,
    ModelKind kind,
    String target,
    int horizon,
    List<ForecastPoint> points,
    @JsonProperty("generated_at") Instant generatedAt
) implements Serializable {

    public ForecastResult {
        points = List.copyOf(points);
        if (points.size() != horizon) {
            throw new IllegalArgumentException(
                    "Forecast for " + target + " has " + points.size() + " points but horizon " + horizon);
        }
    }
}
