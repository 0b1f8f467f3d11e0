package com.flagship.bnpl_ledger.installment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One generated row of a repayment schedule, before it is persisted.
 */
@Value
public class ScheduledInstallment {
    int installmentNumber;
    BigDecimal amount;
    LocalDate dueDate;
}
