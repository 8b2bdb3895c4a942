package com.gridcast.core.forecast;

import com.gridcast.core.model.ForecastResult;

import java.util.List;

/**
 * Consolidated outcome of a "produce a forecast" request.
 */
public record ForecastRun(
    ForecastResult result,
    ModelCandidate candidate,
    List<ForecastAttempt> attempts
) {

    public ForecastRun {
        attempts = List.copyOf(attempts);
    }
}
