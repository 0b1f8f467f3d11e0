package com.flagship.bnpl_ledger.event;

import com.flagship.bnpl_ledger.purchase.PurchaseRequest;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PurchaseRequestCreatedEvent implements LedgerEvent {
    public static final String EVENT_TYPE = "PurchaseRequestCreated";

    UUID eventId;
    UUID purchaseRequestId;
    String referenceNumber;
    UUID merchantId;
    UUID customerId;
    BigDecimal totalAmount;
    Instant expiresAt;
    Instant occurredAt;

    public static PurchaseRequestCreatedEvent from(PurchaseRequest request) {
        return new PurchaseRequestCreatedEvent(UUID.randomUUID(), request.getId(), request.getReferenceNumber(),
            request.getMerchantId(), request.getCustomerId(), request.getTotalAmount(), request.getExpiresAt(),
            request.getCreatedAt());
    }

    @Override
    public UUID getAggregateId() {
        return purchaseRequestId;
    }

    @Override
    public String getAggregateType() {
        return EventAggregates.PURCHASE_REQUEST;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
