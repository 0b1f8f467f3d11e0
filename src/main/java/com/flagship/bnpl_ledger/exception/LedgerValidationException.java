package com.flagship.bnpl_ledger.exception;

/**
 * Raised when input is malformed and the operation is rejected before any state changes.
 */
public class LedgerValidationException extends IllegalArgumentException {

    private final String errorCode;

    public LedgerValidationException(String message) {
        this("VALIDATION_ERROR", message);
    }

    protected LedgerValidationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
