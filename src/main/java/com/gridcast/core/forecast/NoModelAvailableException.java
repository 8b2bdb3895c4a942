package com.gridcast.core.forecast;

import java.util.List;

/**
 * Thrown when every kind in the fallback chain failed to train. Carries the
 * attempt trail so callers can report why each kind failed.
 */
public class NoModelAvailableException extends ForecastingException {

    private final transient List<ForecastAttempt> attempts;

    public NoModelAvailableException(String target, List<ForecastAttempt> attempts) {
        super("NoModelAvailable: no model kind could be trained for " + target
                + (attempts.isEmpty() ? "" : " (" + attempts.size() + " attempts)"));
        this.attempts = List.copyOf(attempts);
    }

    public List<ForecastAttempt> attempts() {
        return attempts;
    }
}
