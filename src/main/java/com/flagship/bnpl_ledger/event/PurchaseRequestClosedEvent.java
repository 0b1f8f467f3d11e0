package com.flagship.bnpl_ledger.event;

import com.flagship.bnpl_ledger.purchase.PurchaseRequest;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A pending request ended without a transaction: rejected, cancelled or expired.
 */
@Value
public class PurchaseRequestClosedEvent implements LedgerEvent {

    UUID eventId;
    UUID purchaseRequestId;
    UUID merchantId;
    UUID customerId;
    PurchaseRequestStatus status;
    String reason;
    Instant occurredAt;

    public static PurchaseRequestClosedEvent from(PurchaseRequest request, Instant now) {
        return new PurchaseRequestClosedEvent(UUID.randomUUID(), request.getId(), request.getMerchantId(),
            request.getCustomerId(), request.getStatus(), request.getRejectionReason(), now);
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
        return switch (status) {
            case REJECTED -> "PurchaseRequestRejected";
            case CANCELLED -> "PurchaseRequestCancelled";
            case EXPIRED -> "PurchaseRequestExpired";
            case PENDING, ACCEPTED -> throw new IllegalStateException("Not a closing status: " + status);
        };
    }
}
