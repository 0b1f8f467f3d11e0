package com.flagship.bnpl_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.reporting.PlatformRevenue;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class PlatformRevenueResponse {

    @JsonProperty("from")
    LocalDate from;

    @JsonProperty("to")
    LocalDate to;

    @JsonProperty("transaction_count")
    long transactionCount;

    @JsonProperty("gross_volume")
    BigDecimal grossVolume;

    @JsonProperty("total_commission")
    BigDecimal totalCommission;

    @JsonProperty("net_to_merchants")
    BigDecimal netToMerchants;

    public static PlatformRevenueResponse from(PlatformRevenue revenue) {
        return new PlatformRevenueResponse(revenue.getFrom(), revenue.getTo(), revenue.getTransactionCount(),
            revenue.getGrossVolume(), revenue.getTotalCommission(), revenue.getNetToMerchants());
    }
}
