package com.gridcast.core.forecast;

/**
 * Base exception for model training and forecast generation failures.
 */
public class ForecastingException extends RuntimeException {
    public ForecastingException(String message) {
        super(message);
    }

    public ForecastingException(String message, Throwable cause) {
        super(message, cause);
    }
}
