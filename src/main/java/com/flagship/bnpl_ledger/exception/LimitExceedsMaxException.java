package com.flagship.bnpl_ledger.exception;

import java.math.BigDecimal;

public class LimitExceedsMaxException extends BusinessRuleException {

    public LimitExceedsMaxException(BigDecimal requested, BigDecimal max) {
        super("LIMIT_EXCEEDS_MAX", String.format(
            "Requested credit limit %s exceeds the maximum of %s",
            requested.toPlainString(), max.toPlainString()));
    }
}
