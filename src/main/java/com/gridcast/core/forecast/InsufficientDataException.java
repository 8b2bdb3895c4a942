package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;

/**
 * Thrown when a series is shorter than the minimum window of a model kind.
 */
public class InsufficientDataException extends ForecastingException {

    private final ModelKind kind;
    private final int required;
    private final int actual;

    public InsufficientDataException(ModelKind kind, int required, int actual) {
        super("InsufficientData: " + kind + " needs at least " + required + " points, got " + actual);
        this.kind = kind;
        this.required = required;
        this.actual = actual;
    }

    public ModelKind kind() {
        return kind;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
