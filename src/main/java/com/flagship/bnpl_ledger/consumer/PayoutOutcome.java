package com.flagship.bnpl_ledger.consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Value;

import java.util.UUID;

/**
 * Message from the payout gateway reporting the bank's answer for a withdrawal.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class PayoutOutcome {
    public static final String PAYOUT_COMPLETED = "PayoutCompleted";
    public static final String PAYOUT_FAILED = "PayoutFailed";

    UUID eventId;
    String eventType;
    UUID settlementId;
    String bankReference;
    String failureReason;
}
