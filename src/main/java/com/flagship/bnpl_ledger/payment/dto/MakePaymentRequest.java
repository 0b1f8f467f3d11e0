package com.flagship.bnpl_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.payment.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class MakePaymentRequest {

    @NotNull(message = "Customer ID is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Payment method is required")
    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;
}
