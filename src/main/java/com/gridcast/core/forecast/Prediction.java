package com.gridcast.core.forecast;

/**
 * Model output for one horizon step, before timestamps are attached.
 */
public record Prediction(double estimate, double lower, double upper) {

    public boolean isFinite() {
        return Double.isFinite(estimate) && Double.isFinite(lower) && Double.isFinite(upper);
    }
}
