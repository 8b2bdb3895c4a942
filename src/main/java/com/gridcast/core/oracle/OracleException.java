package com.gridcast.core.oracle;

/**
 * Thrown when the reasoning oracle returns nothing usable.
 */
public class OracleException extends RuntimeException {
    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
