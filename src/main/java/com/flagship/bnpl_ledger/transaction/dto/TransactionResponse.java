package com.flagship.bnpl_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.transaction.Transaction;
import com.flagship.bnpl_ledger.transaction.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_number")
    String transactionNumber;

    @JsonProperty("merchant_id")
    UUID merchantId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("purchase_request_id")
    UUID purchaseRequestId;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("commission_rate")
    BigDecimal commissionRate;

    @JsonProperty("commission_amount")
    BigDecimal commissionAmount;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("remaining_balance")
    BigDecimal remainingBalance;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .transactionNumber(transaction.getTransactionNumber())
            .merchantId(transaction.getMerchantId())
            .customerId(transaction.getCustomerId())
            .purchaseRequestId(transaction.getPurchaseRequestId())
            .totalAmount(transaction.getTotalAmount())
            .commissionRate(transaction.getCommissionRate())
            .commissionAmount(transaction.getCommissionAmount())
            .netAmount(transaction.getNetAmount())
            .paidAmount(transaction.getPaidAmount())
            .remainingBalance(transaction.getRemainingBalance())
            .status(transaction.getStatus())
            .dueDate(transaction.getDueDate())
            .completedAt(transaction.getCompletedAt())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
