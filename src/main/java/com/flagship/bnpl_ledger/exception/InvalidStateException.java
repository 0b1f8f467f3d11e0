package com.flagship.bnpl_ledger.exception;

/**
 * A transition was attempted from a state that does not allow it.
 */
public class InvalidStateException extends BusinessRuleException {

    public InvalidStateException(String message) {
        super("INVALID_STATE", message);
    }
}
