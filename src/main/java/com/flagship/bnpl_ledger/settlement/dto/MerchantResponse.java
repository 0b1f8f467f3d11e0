package com.flagship.bnpl_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.settlement.MerchantStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class MerchantResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("business_name")
    String businessName;

    @JsonProperty("status")
    MerchantStatus status;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("total_commission_paid")
    BigDecimal totalCommissionPaid;

    @JsonProperty("total_transactions")
    int totalTransactions;

    @JsonProperty("total_volume")
    BigDecimal totalVolume;

    @JsonProperty("bank_details")
    BankDetailsPayload bankDetails;

    @JsonProperty("created_at")
    Instant createdAt;

    public static MerchantResponse from(Merchant merchant) {
        return MerchantResponse.builder()
            .id(merchant.getId())
            .businessName(merchant.getBusinessName())
            .status(merchant.getStatus())
            .balance(merchant.getBalance())
            .totalCommissionPaid(merchant.getTotalCommissionPaid())
            .totalTransactions(merchant.getTotalTransactions())
            .totalVolume(merchant.getTotalVolume())
            .bankDetails(BankDetailsPayload.from(merchant.getBankDetails()))
            .createdAt(merchant.getCreatedAt())
            .build();
    }
}
