package com.gridcast.core.model;

public enum SessionStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    ABORTED
}
