package com.flagship.bnpl_ledger.reporting;

import com.flagship.bnpl_ledger.installment.InstallmentStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One unsettled installment, joined with the transaction it belongs to.
 */
@Value
public class InstallmentView {
    UUID scheduleId;
    UUID transactionId;
    String transactionNumber;
    UUID customerId;
    UUID merchantId;
    int installmentNumber;
    BigDecimal amount;
    BigDecimal paidAmount;
    BigDecimal remainingAmount;
    LocalDate dueDate;
    InstallmentStatus status;
    long daysOverdue;
}
