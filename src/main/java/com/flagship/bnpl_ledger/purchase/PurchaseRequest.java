package com.flagship.bnpl_ledger.purchase;

import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A merchant's offer to sell to a customer on installments.
 *
 * Expiry is lazy: a PENDING request whose {@code expiresAt} has passed is EXPIRED for every
 * reader and writer even before the status column says so. {@link #isExpired(Instant)} is the
 * one place that decides it.
 */
@Value
public class PurchaseRequest {

    public static final int MAX_PRODUCT_NAME_LENGTH = 255;

    UUID id;
    String referenceNumber;
    UUID merchantId;
    UUID customerId;
    String productName;
    String productDescription;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal totalAmount;
    PurchaseRequestStatus status;
    String rejectionReason;
    UUID transactionId;
    Instant expiresAt;
    Instant acceptedAt;
    Instant rejectedAt;
    Instant cancelledAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a PENDING request. {@code totalAmount = quantity * unitPrice}.
     *
     * @throws LedgerValidationException on a blank or over-long product name or quantity below 1
     * @throws com.flagship.bnpl_ledger.exception.InvalidAmountException if the unit price is not a positive amount
     */
    public static PurchaseRequest create(String referenceNumber, UUID merchantId, UUID customerId,
                                         String productName, String productDescription,
                                         int quantity, BigDecimal unitPrice,
                                         Instant now, Duration expiry) {
        if (productName == null || productName.isBlank()) {
            throw new LedgerValidationException("Product name is required");
        }
        if (productName.length() > MAX_PRODUCT_NAME_LENGTH) {
            throw new LedgerValidationException(
                "Product name must be at most " + MAX_PRODUCT_NAME_LENGTH + " characters");
        }
        if (quantity < 1) {
            throw new LedgerValidationException("Quantity must be at least 1, got " + quantity);
        }
        BigDecimal price = Money.positive(unitPrice, "Unit price");
        BigDecimal total = Money.multiply(price, quantity);

        return new PurchaseRequest(UUID.randomUUID(), referenceNumber, merchantId, customerId,
            productName.trim(), productDescription, quantity, price, total,
            PurchaseRequestStatus.PENDING, null, null, now.plus(expiry),
            null, null, null, now, now);
    }

    public boolean isExpired(Instant now) {
        return status == PurchaseRequestStatus.PENDING && !now.isBefore(expiresAt);
    }

    /**
     * The status a reader should see at {@code now}.
     */
    public PurchaseRequestStatus effectiveStatus(Instant now) {
        return isExpired(now) ? PurchaseRequestStatus.EXPIRED : status;
    }

    /**
     * This request as it reads at {@code now}: an overdue PENDING request comes back EXPIRED.
     */
    public PurchaseRequest asOf(Instant now) {
        return isExpired(now) ? expire(now) : this;
    }

    public PurchaseRequest accept(UUID transactionId, Instant now) {
        requireTransition(PurchaseRequestStatus.ACCEPTED, "accept");
        return new PurchaseRequest(id, referenceNumber, merchantId, customerId, productName, productDescription,
            quantity, unitPrice, totalAmount, PurchaseRequestStatus.ACCEPTED, null, transactionId, expiresAt,
            now, null, null, createdAt, now);
    }

    public PurchaseRequest reject(String reason, Instant now) {
        requireTransition(PurchaseRequestStatus.REJECTED, "reject");
        return new PurchaseRequest(id, referenceNumber, merchantId, customerId, productName, productDescription,
            quantity, unitPrice, totalAmount, PurchaseRequestStatus.REJECTED, reason, null, expiresAt,
            null, now, null, createdAt, now);
    }

    public PurchaseRequest cancel(Instant now) {
        requireTransition(PurchaseRequestStatus.CANCELLED, "cancel");
        return new PurchaseRequest(id, referenceNumber, merchantId, customerId, productName, productDescription,
            quantity, unitPrice, totalAmount, PurchaseRequestStatus.CANCELLED, null, null, expiresAt,
            null, null, now, createdAt, now);
    }

    public PurchaseRequest expire(Instant now) {
        requireTransition(PurchaseRequestStatus.EXPIRED, "expire");
        return new PurchaseRequest(id, referenceNumber, merchantId, customerId, productName, productDescription,
            quantity, unitPrice, totalAmount, PurchaseRequestStatus.EXPIRED, null, null, expiresAt,
            null, null, null, createdAt, now);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canTransitionTo(PurchaseRequestStatus target) {
        return switch (status) {
            case PENDING -> target != PurchaseRequestStatus.PENDING;
            case ACCEPTED, REJECTED, EXPIRED, CANCELLED -> false;
        };
    }

    private void requireTransition(PurchaseRequestStatus target, String action) {
        if (!canTransitionTo(target)) {
            throw new InvalidStateException(String.format(
                "Cannot %s purchase request %s in %s status. Only PENDING requests can change.",
                action, id, status));
        }
    }
}
