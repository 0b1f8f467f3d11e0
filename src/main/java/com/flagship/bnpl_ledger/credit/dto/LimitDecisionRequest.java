package com.flagship.bnpl_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class LimitDecisionRequest {

    @NotBlank(message = "Admin is required")
    @Size(max = 100)
    @JsonProperty("admin")
    String admin;

    @Size(max = 1000)
    @JsonProperty("note")
    String note;
}
