package com.flagship.bnpl_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Sent by a merchant to one customer.
 */
@Value
public class SendPurchaseRequest {

    @NotNull(message = "Merchant ID is required")
    @JsonProperty("merchant_id")
    UUID merchantId;

    @NotNull(message = "Customer ID is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotBlank(message = "Product name is required")
    @Size(max = 255, message = "Product name must be at most 255 characters")
    @JsonProperty("product_name")
    String productName;

    @JsonProperty("product_description")
    String productDescription;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    Integer quantity;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.01", message = "Unit price must be greater than 0")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;
}
