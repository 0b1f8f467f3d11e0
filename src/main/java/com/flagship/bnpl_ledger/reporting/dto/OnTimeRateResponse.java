package com.flagship.bnpl_ledger.reporting.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class OnTimeRateResponse {

    @JsonProperty("customer_id")
    UUID customerId;

    /** Percentage, 0 to 100. */
    @JsonProperty("on_time_payment_rate")
    BigDecimal onTimePaymentRate;
}
