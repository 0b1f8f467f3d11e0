package com.flagship.bnpl_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.installment.InstallmentStatus;
import com.flagship.bnpl_ledger.installment.ScheduleRow;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class InstallmentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("installment_number")
    int installmentNumber;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("status")
    InstallmentStatus status;

    @JsonProperty("paid_at")
    Instant paidAt;

    public static InstallmentResponse from(ScheduleRow row) {
        return InstallmentResponse.builder()
            .id(row.getId())
            .installmentNumber(row.getInstallmentNumber())
            .amount(row.getAmount())
            .paidAmount(row.getPaidAmount())
            .dueDate(row.getDueDate())
            .status(row.getStatus())
            .paidAt(row.getPaidAt())
            .build();
    }
}
