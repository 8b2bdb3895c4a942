package com.gridcast.core.decisionlog;

/**
 * Thrown when the ledger store cannot be read or appended to.
 */
public class DecisionLedgerException extends RuntimeException {
    public DecisionLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
