package com.flagship.bnpl_ledger.exception;

/**
 * Base class for expected, user-facing rule violations.
 *
 * These are never retried: the caller gets a clear message and decides what to do.
 */
public abstract class BusinessRuleException extends IllegalStateException {

    private final String errorCode;

    protected BusinessRuleException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
