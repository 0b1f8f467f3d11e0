package com.flagship.bnpl_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CompleteSettlementRequest {

    @NotBlank(message = "Bank reference is required")
    @Size(max = 100)
    @JsonProperty("bank_reference")
    String bankReference;
}
