package com.flagship.bnpl_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.payment.Payment;
import com.flagship.bnpl_ledger.payment.PaymentMethod;
import com.flagship.bnpl_ledger.payment.PaymentResult;
import com.flagship.bnpl_ledger.payment.PaymentStatus;
import com.flagship.bnpl_ledger.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A payment, with its allocations and the resulting transaction balance when they are known.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("installments_covered")
    int installmentsCovered;

    @JsonProperty("allocations")
    List<AllocationResponse> allocations;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("transaction_status")
    TransactionStatus transactionStatus;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(Payment payment) {
        return base(payment).build();
    }

    public static PaymentResponse from(PaymentResult result) {
        PaymentResponseBuilder builder = base(result.getPayment())
            .allocations(result.getAllocations().stream().map(AllocationResponse::from).toList());
        if (result.getTransaction() != null) {
            builder.remainingBalance(result.getTransaction().getRemainingBalance())
                .transactionStatus(result.getTransaction().getStatus());
        }
        return builder.build();
    }

    private static PaymentResponseBuilder base(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .referenceNumber(payment.getReferenceNumber())
            .transactionId(payment.getTransactionId())
            .customerId(payment.getCustomerId())
            .amount(payment.getAmount())
            .paymentMethod(payment.getPaymentMethod())
            .status(payment.getStatus())
            .installmentsCovered(payment.getInstallmentsCovered())
            .createdAt(payment.getCreatedAt());
    }
}
