package com.flagship.bnpl_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Omitting {@code credit_limit} gives the customer the default limit.
 */
@Value
public class RegisterCustomerRequest {

    @DecimalMin(value = "0.00", message = "Credit limit cannot be negative")
    @Digits(integer = 17, fraction = 2, message = "Credit limit can have at most 2 decimals")
    @JsonProperty("credit_limit")
    BigDecimal creditLimit;
}
