package com.gridcast.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A single forecast step. Construction enforces {@code lower <= estimate <= upper}.
 */
public record ForecastPoint(
    Instant timestamp,
    double estimate,
    double lower,
    double upper
) implements Serializable {

    public ForecastPoint {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        if (!(lower <= estimate && estimate <= upper)) {
            throw new IllegalArgumentException(
                    "Forecast bounds out of order at " + timestamp + ": " + lower + " / " + estimate + " / " + upper);
        }
    }

    public double intervalWidth() {
        return upper - lower;
    }
}
