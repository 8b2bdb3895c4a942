package com.gridcast.core.capability;

/**
 * Value types a capability parameter may declare.
 */
public enum ParameterType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    /** ISO-8601 calendar date, e.g. {@code 2025-01-31}. */
    DATE,
    /** ISO-8601 instant or offset date-time. */
    TIMESTAMP,
    /** One of the declared allowed values, matched case-insensitively. */
    ENUM
}
