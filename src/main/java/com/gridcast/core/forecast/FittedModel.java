package com.gridcast.core.forecast;

import java.util.List;
import java.util.Map;

/**
 * A model fitted to a specific series. Immutable; predictions are a pure function of the fit.
 */
public interface FittedModel {

    /**
     * Fitted parameters, for reporting only.
     */
    Map<String, Object> parameters();

    /**
     * Predicts the {@code horizon} steps that follow the fitted series.
     */
    List<Prediction> predict(int horizon);
}
