package com.flagship.bnpl_ledger.exception;

/**
 * A ledger invariant does not hold. This is a bug in the engine or corrupted data,
 * never bad input: the surrounding transaction is rolled back and the error is not retried.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
