package com.flagship.bnpl_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class LimitIncreaseRequest {

    @NotNull(message = "New limit is required")
    @DecimalMin(value = "0.01", message = "New limit must be greater than 0")
    @JsonProperty("new_limit")
    BigDecimal newLimit;

    @Size(max = 1000)
    @JsonProperty("reason")
    String reason;
}
