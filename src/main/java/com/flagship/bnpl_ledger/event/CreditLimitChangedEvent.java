package com.flagship.bnpl_ledger.event;

import com.flagship.bnpl_ledger.credit.CustomerLimitHistory;
import com.flagship.bnpl_ledger.credit.LimitRequestStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class CreditLimitChangedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "CreditLimitChanged";

    UUID eventId;
    UUID customerId;
    UUID limitRequestId;
    BigDecimal previousLimit;
    BigDecimal requestedLimit;
    BigDecimal newLimit;
    LimitRequestStatus status;
    String decidedBy;
    Instant occurredAt;

    public static CreditLimitChangedEvent from(CustomerLimitHistory history, Instant now) {
        return new CreditLimitChangedEvent(UUID.randomUUID(), history.getCustomerId(), history.getId(),
            history.getPreviousLimit(), history.getRequestedLimit(), history.getNewLimit(), history.getStatus(),
            history.getDecidedBy(), now);
    }

    @Override
    public UUID getAggregateId() {
        return customerId;
    }

    @Override
    public String getAggregateType() {
        return EventAggregates.CUSTOMER;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
