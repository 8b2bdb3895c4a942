package com.gridcast.core.forecast;

import com.gridcast.core.model.ModelKind;

/**
 * Thrown when the invocation that requested training was abandoned (typically after a
 * dispatcher timeout) before the trained candidate could be stored.
 */
public class TrainingAbandonedException extends ForecastingException {
    public TrainingAbandonedException(String target, ModelKind kind) {
        super("Training of " + kind + " for " + target + " was abandoned before commit; candidate discarded");
    }
}
