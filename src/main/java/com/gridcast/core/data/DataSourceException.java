package com.gridcast.core.data;

/**
 * Thrown when the demand store cannot be queried.
 */
public class DataSourceException extends RuntimeException {
    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
