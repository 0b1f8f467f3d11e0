package com.flagship.bnpl_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class FailSettlementRequest {

    @NotBlank(message = "Reason is required")
    @Size(max = 1000)
    @JsonProperty("reason")
    String reason;
}
