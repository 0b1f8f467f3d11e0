package com.flagship.bnpl_ledger.event;

import com.flagship.bnpl_ledger.installment.RepaymentPlan;
import com.flagship.bnpl_ledger.transaction.Transaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A purchase request was accepted and turned into a transaction with a repayment plan.
 */
@Value
public class PurchaseAcceptedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "PurchaseAccepted";

    UUID eventId;
    UUID transactionId;
    String transactionNumber;
    UUID purchaseRequestId;
    UUID merchantId;
    UUID customerId;
    BigDecimal totalAmount;
    BigDecimal commissionAmount;
    BigDecimal netAmount;
    int numberOfInstallments;
    LocalDate firstDueDate;
    LocalDate finalDueDate;
    Instant occurredAt;

    public static PurchaseAcceptedEvent from(Transaction transaction, RepaymentPlan plan, LocalDate firstDueDate) {
        return new PurchaseAcceptedEvent(UUID.randomUUID(), transaction.getId(), transaction.getTransactionNumber(),
            transaction.getPurchaseRequestId(), transaction.getMerchantId(), transaction.getCustomerId(),
            transaction.getTotalAmount(), transaction.getCommissionAmount(), transaction.getNetAmount(),
            plan.getNumberOfInstallments(), firstDueDate, transaction.getDueDate(), transaction.getCreatedAt());
    }

    @Override
    public UUID getAggregateId() {
        return transactionId;
    }

    @Override
    public String getAggregateType() {
        return EventAggregates.TRANSACTION;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
