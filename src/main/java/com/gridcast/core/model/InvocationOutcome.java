package com.gridcast.core.model;

public enum InvocationOutcome {
    OK,
    ERROR,
    TIMEOUT
}
