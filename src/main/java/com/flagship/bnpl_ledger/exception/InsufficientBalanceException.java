package com.flagship.bnpl_ledger.exception;

import java.math.BigDecimal;
import java.util.UUID;

public class InsufficientBalanceException extends BusinessRuleException {

    public InsufficientBalanceException(UUID merchantId, BigDecimal requested, BigDecimal balance) {
        super("INSUFFICIENT_BALANCE", String.format(
            "Merchant %s has insufficient balance: requested=%s, balance=%s",
            merchantId, requested.toPlainString(), balance.toPlainString()));
    }
}
