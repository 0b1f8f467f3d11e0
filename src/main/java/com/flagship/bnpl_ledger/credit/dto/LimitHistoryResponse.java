package com.flagship.bnpl_ledger.credit.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bnpl_ledger.credit.CustomerLimitHistory;
import com.flagship.bnpl_ledger.credit.LimitRequestStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LimitHistoryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("previous_limit")
    BigDecimal previousLimit;

    @JsonProperty("requested_limit")
    BigDecimal requestedLimit;

    @JsonProperty("new_limit")
    BigDecimal newLimit;

    @JsonProperty("status")
    LimitRequestStatus status;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("decided_by")
    String decidedBy;

    @JsonProperty("decision_note")
    String decisionNote;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("decided_at")
    Instant decidedAt;

    public static LimitHistoryResponse from(CustomerLimitHistory history) {
        return LimitHistoryResponse.builder()
            .id(history.getId())
            .customerId(history.getCustomerId())
            .previousLimit(history.getPreviousLimit())
            .requestedLimit(history.getRequestedLimit())
            .newLimit(history.getNewLimit())
            .status(history.getStatus())
            .reason(history.getReason())
            .decidedBy(history.getDecidedBy())
            .decisionNote(history.getDecisionNote())
            .createdAt(history.getCreatedAt())
            .decidedAt(history.getDecidedAt())
            .build();
    }
}
