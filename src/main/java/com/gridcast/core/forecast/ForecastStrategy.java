package com.gridcast.core.forecast;

public enum ForecastStrategy {
    /** Use the first kind in chain order that trains successfully. */
    FALLBACK,
    /** Train every kind and forecast with the best-ranked candidate. */
    BEST
}
