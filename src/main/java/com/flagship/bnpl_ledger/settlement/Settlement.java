package com.flagship.bnpl_ledger.settlement;

import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One movement of merchant money.
 *
 * INCOME settlements are written COMPLETED when a purchase is accepted. WITHDRAWAL settlements
 * start PENDING and go through the payout lifecycle:
 * PENDING → PROCESSING → COMPLETED, with FAILED reachable from PENDING or PROCESSING.
 */
@Value
public class Settlement {
    UUID id;
    String settlementReference;
    UUID merchantId;
    UUID transactionId;
    SettlementType settlementType;
    BigDecimal grossAmount;
    BigDecimal commissionRate;
    BigDecimal commissionAmount;
    BigDecimal netAmount;
    SettlementStatus status;
    BankDetails bankDetails;
    String bankReference;
    String failureReason;
    Instant processedAt;
    Instant completedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Settlement income(String reference, UUID merchantId, UUID transactionId,
                                    CommissionBreakdown breakdown, Instant now) {
        return new Settlement(UUID.randomUUID(), reference, merchantId, transactionId, SettlementType.INCOME,
            breakdown.getGrossAmount(), breakdown.getCommissionRate(), breakdown.getCommissionAmount(),
            breakdown.getNetAmount(), SettlementStatus.COMPLETED, null, null, null, now, now, now, now);
    }

    public static Settlement withdrawal(String reference, UUID merchantId, BigDecimal amount,
                                        BankDetails bankDetails, Instant now) {
        return new Settlement(UUID.randomUUID(), reference, merchantId, null, SettlementType.WITHDRAWAL,
            amount, BigDecimal.ZERO, Money.ZERO, amount, SettlementStatus.PENDING, bankDetails,
            null, null, null, null, now, now);
    }

    public Settlement markProcessing(Instant now) {
        requireTransition(SettlementStatus.PROCESSING, "process");
        return new Settlement(id, settlementReference, merchantId, transactionId, settlementType, grossAmount,
            commissionRate, commissionAmount, netAmount, SettlementStatus.PROCESSING, bankDetails,
            bankReference, null, now, null, createdAt, now);
    }

    public Settlement complete(String reference, Instant now) {
        requireTransition(SettlementStatus.COMPLETED, "complete");
        return new Settlement(id, settlementReference, merchantId, transactionId, settlementType, grossAmount,
            commissionRate, commissionAmount, netAmount, SettlementStatus.COMPLETED, bankDetails,
            reference, null, processedAt != null ? processedAt : now, now, createdAt, now);
    }

    public Settlement fail(String reason, Instant now) {
        requireTransition(SettlementStatus.FAILED, "fail");
        return new Settlement(id, settlementReference, merchantId, transactionId, settlementType, grossAmount,
            commissionRate, commissionAmount, netAmount, SettlementStatus.FAILED, bankDetails,
            bankReference, reason, processedAt != null ? processedAt : now, null, createdAt, now);
    }

    public boolean isWithdrawal() {
        return settlementType == SettlementType.WITHDRAWAL;
    }

    public boolean canTransitionTo(SettlementStatus target) {
        if (settlementType == SettlementType.INCOME) {
            return false;
        }
        return switch (status) {
            case PENDING -> target == SettlementStatus.PROCESSING
                || target == SettlementStatus.COMPLETED
                || target == SettlementStatus.FAILED;
            case PROCESSING -> target == SettlementStatus.COMPLETED || target == SettlementStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    private void requireTransition(SettlementStatus target, String action) {
        if (!canTransitionTo(target)) {
            throw new InvalidStateException(String.format(
                "Cannot %s %s settlement %s in %s status", action, settlementType, id, status));
        }
    }
}
