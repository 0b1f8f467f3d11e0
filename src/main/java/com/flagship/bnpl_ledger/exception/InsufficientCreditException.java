package com.flagship.bnpl_ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

public class InsufficientCreditException extends BusinessRuleException {

    public InsufficientCreditException(UUID customerId, BigDecimal requested, BigDecimal available) {
        super("INSUFFICIENT_CREDIT", String.format(
            "Customer %s has insufficient credit: requested=%s, available=%s",
            customerId, requested.toPlainString(), available.toPlainString()));
    }
}
