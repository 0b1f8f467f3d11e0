package com.flagship.bnpl_ledger.credit;

import com.flagship.bnpl_ledger.exception.InvalidStateException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit record of one credit limit change request.
 *
 * {@code newLimit} is the limit actually in force after the decision: it equals
 * {@code previousLimit} while the request is pending or when it is rejected.
 */
@Value
public class CustomerLimitHistory {

    public static final String AUTO_APPROVER = "auto";

    UUID id;
    UUID customerId;
    BigDecimal previousLimit;
    BigDecimal requestedLimit;
    BigDecimal newLimit;
    LimitRequestStatus status;
    String reason;
    String decidedBy;
    String decisionNote;
    Instant createdAt;
    Instant decidedAt;

    public static CustomerLimitHistory pending(UUID customerId, BigDecimal previousLimit,
                                               BigDecimal requestedLimit, String reason, Instant now) {
        return new CustomerLimitHistory(UUID.randomUUID(), customerId, previousLimit, requestedLimit,
            previousLimit, LimitRequestStatus.PENDING, reason, null, null, now, null);
    }

    public static CustomerLimitHistory autoApproved(UUID customerId, BigDecimal previousLimit,
                                                    BigDecimal requestedLimit, String reason, Instant now) {
        return new CustomerLimitHistory(UUID.randomUUID(), customerId, previousLimit, requestedLimit,
            requestedLimit, LimitRequestStatus.APPROVED, reason, AUTO_APPROVER, null, now, now);
    }

    public CustomerLimitHistory approve(BigDecimal appliedFrom, String approver, String note, Instant now) {
        requirePending("approve");
        return new CustomerLimitHistory(id, customerId, appliedFrom, requestedLimit, requestedLimit,
            LimitRequestStatus.APPROVED, reason, approver, note, createdAt, now);
    }

    public CustomerLimitHistory reject(String approver, String note, Instant now) {
        requirePending("reject");
        return new CustomerLimitHistory(id, customerId, previousLimit, requestedLimit, previousLimit,
            LimitRequestStatus.REJECTED, reason, approver, note, createdAt, now);
    }

    public boolean isPending() {
        return status == LimitRequestStatus.PENDING;
    }

    private void requirePending(String action) {
        if (status != LimitRequestStatus.PENDING) {
            throw new InvalidStateException(String.format(
                "Cannot %s limit request %s in %s status. Only PENDING requests can be decided.",
                action, id, status));
        }
    }
}
