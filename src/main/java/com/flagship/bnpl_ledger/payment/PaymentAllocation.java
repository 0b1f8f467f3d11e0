package com.flagship.bnpl_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The part of a payment that went to one installment.
 */
@Value
public class PaymentAllocation {
    UUID id;
    UUID paymentId;
    UUID scheduleId;
    int installmentNumber;
    BigDecimal amount;
}
