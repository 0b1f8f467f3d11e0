package com.flagship.bnpl_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.credit.CustomerStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class CustomerStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    CustomerStatus status;
}
