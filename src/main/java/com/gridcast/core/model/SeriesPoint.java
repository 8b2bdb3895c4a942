package com.gridcast.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One observation of a demand series.
 *
 * @param timestamp start of the observed interval
 * @param value     demand in MW
 */
public record SeriesPoint(Instant timestamp, double value) implements Serializable {

    public SeriesPoint {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
