package com.flagship.bnpl_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.installment.InstallmentStatus;
import com.flagship.bnpl_ledger.reporting.InstallmentView;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class InstallmentViewResponse {

    @JsonProperty("schedule_id")
    UUID scheduleId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("transaction_number")
    String transactionNumber;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("merchant_id")
    UUID merchantId;

    @JsonProperty("installment_number")
    int installmentNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("remaining_amount")
    BigDecimal remainingAmount;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    InstallmentStatus status;

    @JsonProperty("days_overdue")
    long daysOverdue;

    public static InstallmentViewResponse from(InstallmentView view) {
        return InstallmentViewResponse.builder()
            .scheduleId(view.getScheduleId())
            .transactionId(view.getTransactionId())
            .transactionNumber(view.getTransactionNumber())
            .customerId(view.getCustomerId())
            .merchantId(view.getMerchantId())
            .installmentNumber(view.getInstallmentNumber())
            .amount(view.getAmount())
            .paidAmount(view.getPaidAmount())
            .remainingAmount(view.getRemainingAmount())
            .dueDate(view.getDueDate())
            .status(view.getStatus())
            .daysOverdue(view.getDaysOverdue())
            .build();
    }
}
