package com.gridcast.core.model;

/**
 * Classification of every failure that can surface from a capability or the decision loop.
 */
public enum ErrorKind {
    /** Arguments did not match the capability's parameter schema. */
    VALIDATION_FAILED,
    CAPABILITY_NOT_FOUND,
    TIMEOUT,
    INSUFFICIENT_DATA,
    /** Every model kind in the fallback chain failed to train. */
    NO_MODEL_AVAILABLE,
    /** A model kind could not be fitted for a reason other than window length. */
    TRAINING_FAILED,
    /** The data source holds no demand data at all. */
    NO_DATA,
    STALE_DATA,
    REASONING_DIVERGENCE,
    ORACLE_FAILURE,
    INTERNAL_CAPABILITY_ERROR,
    ABORTED
}
