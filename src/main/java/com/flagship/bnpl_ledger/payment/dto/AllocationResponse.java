package com.flagship.bnpl_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.payment.PaymentAllocation;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class AllocationResponse {

    @JsonProperty("schedule_id")
    UUID scheduleId;

    @JsonProperty("installment_number")
    int installmentNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    public static AllocationResponse from(PaymentAllocation allocation) {
        return new AllocationResponse(allocation.getScheduleId(), allocation.getInstallmentNumber(), allocation.getAmount());
    }
}
