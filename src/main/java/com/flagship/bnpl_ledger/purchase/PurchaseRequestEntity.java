package com.flagship.bnpl_ledger.purchase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "purchase_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseRequestEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "reference_number", nullable = false, updatable = false, length = 40)
    private String referenceNumber;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private UUID merchantId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "product_name", nullable = false, updatable = false)
    private String productName;

    @Column(name = "product_description", updatable = false)
    private String productDescription;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PurchaseRequestStatus status;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @Column(name = "transaction_id")
    private UUID transactionId;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    static PurchaseRequestEntity fromDomain(PurchaseRequest request) {
        return new PurchaseRequestEntity(
            request.getId(),
            request.getReferenceNumber(),
            request.getMerchantId(),
            request.getCustomerId(),
            request.getProductName(),
            request.getProductDescription(),
            request.getQuantity(),
            request.getUnitPrice(),
            request.getTotalAmount(),
            request.getStatus(),
            request.getRejectionReason(),
            request.getTransactionId(),
            request.getExpiresAt(),
            request.getAcceptedAt(),
            request.getRejectedAt(),
            request.getCancelledAt(),
            null,
            request.getCreatedAt(),
            request.getUpdatedAt()
        );
    }

    public PurchaseRequest toDomain() {
        return new PurchaseRequest(id, referenceNumber, merchantId, customerId, productName, productDescription,
            quantity, unitPrice, totalAmount, status, rejectionReason, transactionId, expiresAt,
            acceptedAt, rejectedAt, cancelledAt, createdAt, updatedAt);
    }

    void updateFromDomain(PurchaseRequest request) {
        this.status = request.getStatus();
        this.rejectionReason = request.getRejectionReason();
        this.transactionId = request.getTransactionId();
        this.acceptedAt = request.getAcceptedAt();
        this.rejectedAt = request.getRejectedAt();
        this.cancelledAt = request.getCancelledAt();
    }
}
