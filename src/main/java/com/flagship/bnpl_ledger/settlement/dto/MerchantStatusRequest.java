package com.flagship.bnpl_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.settlement.MerchantStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class MerchantStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    MerchantStatus status;
}
