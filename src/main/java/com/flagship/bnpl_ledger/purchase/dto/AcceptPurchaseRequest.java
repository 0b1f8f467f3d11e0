package com.flagship.bnpl_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class AcceptPurchaseRequest {

    @NotNull(message = "Customer ID is required")
    @JsonProperty("customer_id")
    UUID customerId;

    /** Number of installments: 1, 3, 6, 12, 18 or 24. */
    @NotNull(message = "Plan type is required")
    @JsonProperty("plan_type")
    Integer planType;
}
