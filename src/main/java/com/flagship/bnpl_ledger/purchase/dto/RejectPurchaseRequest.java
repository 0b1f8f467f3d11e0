package com.flagship.bnpl_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class RejectPurchaseRequest {

    @NotNull(message = "Customer ID is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @Size(max = 1000)
    @JsonProperty("reason")
    String reason;
}
