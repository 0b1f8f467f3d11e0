package com.flagship.bnpl_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.settlement.Settlement;
import com.flagship.bnpl_ledger.settlement.SettlementStatus;
import com.flagship.bnpl_ledger.settlement.SettlementType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("settlement_reference")
    String settlementReference;

    @JsonProperty("merchant_id")
    UUID merchantId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("settlement_type")
    SettlementType settlementType;

    @JsonProperty("gross_amount")
    BigDecimal grossAmount;

    @JsonProperty("commission_rate")
    BigDecimal commissionRate;

    @JsonProperty("commission_amount")
    BigDecimal commissionAmount;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("status")
    SettlementStatus status;

    @JsonProperty("bank_details")
    BankDetailsPayload bankDetails;

    @JsonProperty("bank_reference")
    String bankReference;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("processed_at")
    Instant processedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static SettlementResponse from(Settlement settlement) {
        if (settlement == null) {
            return null;
        }
        return SettlementResponse.builder()
            .id(settlement.getId())
            .settlementReference(settlement.getSettlementReference())
            .merchantId(settlement.getMerchantId())
            .transactionId(settlement.getTransactionId())
            .settlementType(settlement.getSettlementType())
            .grossAmount(settlement.getGrossAmount())
            .commissionRate(settlement.getCommissionRate())
            .commissionAmount(settlement.getCommissionAmount())
            .netAmount(settlement.getNetAmount())
            .status(settlement.getStatus())
            .bankDetails(BankDetailsPayload.from(settlement.getBankDetails()))
            .bankReference(settlement.getBankReference())
            .failureReason(settlement.getFailureReason())
            .processedAt(settlement.getProcessedAt())
            .completedAt(settlement.getCompletedAt())
            .createdAt(settlement.getCreatedAt())
            .build();
    }
}
