package com.flagship.bnpl_ledger.exception;

/**
 * The caller is not the party allowed to act on the resource (e.g. a customer rejecting
 * someone else's purchase request).
 */
public class ForbiddenOperationException extends RuntimeException {

    public ForbiddenOperationException(String message) {
        super(message);
    }
}
