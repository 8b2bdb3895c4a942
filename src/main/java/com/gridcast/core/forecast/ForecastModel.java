package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;

/**
 * A forecasting strategy that can be fitted to a series of equally spaced values.
 */
public interface ForecastModel {

    ModelKind kind();

    /**
     * Minimum number of points {@link #fit} accepts.
     */
    int minimumWindow();

    /**
     * @throws InsufficientDataException if {@code values} is shorter than {@link #minimumWindow()}
     * @throws ForecastingException      if the model cannot be fitted to the values
     */
    FittedModel fit(double[] values);
}
