package com.flagship.bnpl_ledger.exception;

import java.time.Instant;
import java.util.UUID;

public class RequestExpiredException extends BusinessRuleException {

    public RequestExpiredException(UUID requestId, Instant expiredAt) {
        super("REQUEST_EXPIRED", "Purchase request " + requestId + " expired at " + expiredAt);
    }
}
