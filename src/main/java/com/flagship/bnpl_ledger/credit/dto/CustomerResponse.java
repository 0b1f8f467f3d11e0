package com.flagship.bnpl_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.credit.CustomerStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CustomerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("customer_code")
    String customerCode;

    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @JsonProperty("available_balance")
    BigDecimal availableBalance;

    @JsonProperty("outstanding_balance")
    BigDecimal outstandingBalance;

    @JsonProperty("status")
    CustomerStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static CustomerResponse from(Customer customer) {
        return CustomerResponse.builder()
            .id(customer.getId())
            .customerCode(customer.getCustomerCode())
            .creditLimit(customer.getCreditLimit())
            .availableBalance(customer.getAvailableBalance())
            .outstandingBalance(customer.getOutstandingBalance())
            .status(customer.getStatus())
            .createdAt(customer.getCreatedAt())
            .updatedAt(customer.getUpdatedAt())
            .build();
    }
}
