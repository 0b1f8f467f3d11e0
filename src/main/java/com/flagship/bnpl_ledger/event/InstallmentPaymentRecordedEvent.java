package com.flagship.bnpl_ledger.event;

import com.flagship.bnpl_ledger.payment.Payment;
import com.flagship.bnpl_ledger.transaction.Transaction;
import com.flagship.bnpl_ledger.transaction.TransactionStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class InstallmentPaymentRecordedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "InstallmentPaymentRecorded";

    UUID eventId;
    UUID transactionId;
    UUID paymentId;
    String paymentReference;
    UUID customerId;
    BigDecimal amount;
    int installmentsCovered;
    BigDecimal paidAmount;
    BigDecimal remainingBalance;
    TransactionStatus transactionStatus;
    Instant occurredAt;

    public static InstallmentPaymentRecordedEvent from(Payment payment, Transaction transaction) {
        return new InstallmentPaymentRecordedEvent(UUID.randomUUID(), transaction.getId(), payment.getId(),
            payment.getReferenceNumber(), payment.getCustomerId(), payment.getAmount(),
            payment.getInstallmentsCovered(), transaction.getPaidAmount(), transaction.getRemainingBalance(),
            transaction.getStatus(), payment.getCreatedAt());
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
