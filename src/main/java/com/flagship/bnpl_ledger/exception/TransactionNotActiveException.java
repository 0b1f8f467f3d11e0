package com.flagship.bnpl_ledger.exception;

import com.flagship.bnpl_ledger.transaction.TransactionStatus;

import java.util.UUID;

public class TransactionNotActiveException extends BusinessRuleException {

    public TransactionNotActiveException(UUID transactionId, TransactionStatus status) {
        super("TRANSACTION_NOT_ACTIVE",
            "Transaction " + transactionId + " does not accept payments in " + status + " status");
    }
}
