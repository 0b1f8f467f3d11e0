package com.flagship.bnpl_ledger.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterMerchantRequest {

    @NotBlank(message = "Business name is required")
    @Size(max = 255)
    @JsonProperty("business_name")
    String businessName;

    @Valid
    @JsonProperty("bank_details")
    BankDetailsPayload bankDetails;
}
