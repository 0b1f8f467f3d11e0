package com.flagship.bnpl_ledger.exception;

/**
 * A money amount that is non-positive, has more than two decimals, or exceeds what is owed.
 */
public class InvalidAmountException extends LedgerValidationException {

    public InvalidAmountException(String message) {
        super("INVALID_AMOUNT", message);
    }
}
