package com.flagship.bnpl_ledger.event;

import com.flagship.bnpl_ledger.settlement.Settlement;
import com.flagship.bnpl_ledger.settlement.SettlementStatus;
import com.flagship.bnpl_ledger.settlement.SettlementType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Any change of a settlement: income recorded, withdrawal requested, payout completed or failed.
 * The event type is derived from the settlement's type and status.
 */
@Value
public class SettlementEvent implements LedgerEvent {
    public static final String INCOME_RECORDED = "SettlementIncomeRecorded";
    public static final String WITHDRAWAL_REQUESTED = "WithdrawalRequested";
    public static final String WITHDRAWAL_PROCESSING = "WithdrawalProcessing";
    public static final String WITHDRAWAL_COMPLETED = "WithdrawalCompleted";
    public static final String WITHDRAWAL_FAILED = "WithdrawalFailed";

    UUID eventId;
    UUID settlementId;
    String settlementReference;
    UUID merchantId;
    UUID transactionId;
    SettlementType settlementType;
    SettlementStatus status;
    BigDecimal grossAmount;
    BigDecimal commissionAmount;
    BigDecimal netAmount;
    String failureReason;
    Instant occurredAt;

    public static SettlementEvent from(Settlement settlement, Instant now) {
        return new SettlementEvent(UUID.randomUUID(), settlement.getId(), settlement.getSettlementReference(),
            settlement.getMerchantId(), settlement.getTransactionId(), settlement.getSettlementType(),
            settlement.getStatus(), settlement.getGrossAmount(), settlement.getCommissionAmount(),
            settlement.getNetAmount(), settlement.getFailureReason(), now);
    }

    @Override
    public UUID getAggregateId() {
        return merchantId;
    }

    @Override
    public String getAggregateType() {
        return EventAggregates.MERCHANT;
    }

    @Override
    public String getEventType() {
        if (settlementType == SettlementType.INCOME) {
            return INCOME_RECORDED;
        }
        return switch (status) {
            case PENDING -> WITHDRAWAL_REQUESTED;
            case PROCESSING -> WITHDRAWAL_PROCESSING;
            case COMPLETED -> WITHDRAWAL_COMPLETED;
            case FAILED -> WITHDRAWAL_FAILED;
        };
    }
}
