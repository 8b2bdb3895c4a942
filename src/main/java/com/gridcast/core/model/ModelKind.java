package com.gridcast.core.model;

/**
 * Forecasting strategies known to the model manager, listed in default fallback order.
 */
public enum ModelKind {
    SEASONAL_DECOMPOSITION("SEAS"),
    AUTOREGRESSIVE("AR"),
    NAIVE_BASELINE("NAIVE");

    private final String code;

    ModelKind(String code) {
        this.code = code;
    }

    /** Short prefix used in candidate identifiers. */
    public String code() {
        return code;
    }
}
