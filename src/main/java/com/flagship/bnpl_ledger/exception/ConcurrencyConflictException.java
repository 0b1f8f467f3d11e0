package com.flagship.bnpl_ledger.exception;

/**
 * Surfaced after the bounded retries on lock or version conflicts are exhausted.
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(String operation, Throwable cause) {
        super("Resource busy, operation '" + operation + "' could not acquire its rows; retry later", cause);
    }
}
