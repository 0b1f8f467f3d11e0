package com.flagship.bnpl_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.installment.PlanSchedule;
import com.flagship.bnpl_ledger.installment.PlanStatus;
import com.flagship.bnpl_ledger.installment.RepaymentPlan;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A repayment plan together with its installment rows.
 */
@Value
@Builder
public class ScheduleResponse {

    @JsonProperty("plan_id")
    UUID planId;

    @JsonProperty("plan_reference")
    String planReference;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("plan_type")
    int planType;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("installment_amount")
    BigDecimal installmentAmount;

    @JsonProperty("installments_paid")
    int installmentsPaid;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("remaining_amount")
    BigDecimal remainingAmount;

    @JsonProperty("status")
    PlanStatus status;

    @JsonProperty("next_payment_date")
    LocalDate nextPaymentDate;

    @JsonProperty("next_payment_amount")
    BigDecimal nextPaymentAmount;

    @JsonProperty("installments")
    List<InstallmentResponse> installments;

    public static ScheduleResponse from(PlanSchedule schedule) {
        RepaymentPlan plan = schedule.getPlan();
        return ScheduleResponse.builder()
            .planId(plan.getId())
            .planReference(plan.getPlanReference())
            .transactionId(plan.getTransactionId())
            .planType(plan.getPlanType().getInstallments())
            .totalAmount(plan.getTotalAmount())
            .installmentAmount(plan.getInstallmentAmount())
            .installmentsPaid(plan.getInstallmentsPaid())
            .amountPaid(plan.getAmountPaid())
            .remainingAmount(plan.getRemainingAmount())
            .status(plan.getStatus())
            .nextPaymentDate(plan.getNextPaymentDate())
            .nextPaymentAmount(plan.getNextPaymentAmount())
            .installments(schedule.getRows().stream().map(InstallmentResponse::from).toList())
            .build();
    }
}
