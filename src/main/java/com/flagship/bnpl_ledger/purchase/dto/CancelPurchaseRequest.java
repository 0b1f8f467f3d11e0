package com.flagship.bnpl_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class CancelPurchaseRequest {

    @NotNull(message = "Merchant ID is required")
    @JsonProperty("merchant_id")
    UUID merchantId;
}
