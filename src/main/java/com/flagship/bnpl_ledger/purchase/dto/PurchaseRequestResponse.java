package com.flagship.bnpl_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.purchase.PurchaseRequest;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PurchaseRequestResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("merchant_id")
    UUID merchantId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("product_name")
    String productName;

    @JsonProperty("product_description")
    String productDescription;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("status")
    PurchaseRequestStatus status;

    @JsonProperty("rejection_reason")
    String rejectionReason;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("accepted_at")
    Instant acceptedAt;

    @JsonProperty("rejected_at")
    Instant rejectedAt;

    @JsonProperty("cancelled_at")
    Instant cancelledAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PurchaseRequestResponse from(PurchaseRequest request) {
        return PurchaseRequestResponse.builder()
            .id(request.getId())
            .referenceNumber(request.getReferenceNumber())
            .merchantId(request.getMerchantId())
            .customerId(request.getCustomerId())
            .productName(request.getProductName())
            .productDescription(request.getProductDescription())
            .quantity(request.getQuantity())
            .unitPrice(request.getUnitPrice())
            .totalAmount(request.getTotalAmount())
            .status(request.getStatus())
            .rejectionReason(request.getRejectionReason())
            .transactionId(request.getTransactionId())
            .expiresAt(request.getExpiresAt())
            .acceptedAt(request.getAcceptedAt())
            .rejectedAt(request.getRejectedAt())
            .cancelledAt(request.getCancelledAt())
            .createdAt(request.getCreatedAt())
            .build();
    }
}
