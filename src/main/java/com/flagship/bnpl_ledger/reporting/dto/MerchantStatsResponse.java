package com.flagship.bnpl_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.reporting.MerchantStats;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class MerchantStatsResponse {

    @JsonProperty("merchant_id")
    UUID merchantId;

    @JsonProperty("total_transactions")
    long totalTransactions;

    @JsonProperty("total_volume")
    BigDecimal totalVolume;

    @JsonProperty("active_transactions")
    long activeTransactions;

    @JsonProperty("completed_transactions")
    long completedTransactions;

    @JsonProperty("total_income")
    BigDecimal totalIncome;

    @JsonProperty("total_commission")
    BigDecimal totalCommission;

    @JsonProperty("total_withdrawn")
    BigDecimal totalWithdrawn;

    @JsonProperty("pending_withdrawals")
    BigDecimal pendingWithdrawals;

    @JsonProperty("withdrawn_this_month")
    BigDecimal withdrawnThisMonth;

    @JsonProperty("balance")
    BigDecimal balance;

    public static MerchantStatsResponse from(UUID merchantId, MerchantStats stats) {
        return MerchantStatsResponse.builder()
            .merchantId(merchantId)
            .totalTransactions(stats.getTotalTransactions())
            .totalVolume(stats.getTotalVolume())
            .activeTransactions(stats.getActiveTransactions())
            .completedTransactions(stats.getCompletedTransactions())
            .totalIncome(stats.getTotalIncome())
            .totalCommission(stats.getTotalCommission())
            .totalWithdrawn(stats.getTotalWithdrawn())
            .pendingWithdrawals(stats.getPendingWithdrawals())
            .withdrawnThisMonth(stats.getWithdrawnThisMonth())
            .balance(stats.getBalance())
            .build();
    }
}
