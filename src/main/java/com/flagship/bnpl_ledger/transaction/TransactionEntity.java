package com.flagship.bnpl_ledger.transaction;

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
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "transaction_number", nullable = false, updatable = false, length = 40)
    private String transactionNumber;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private UUID merchantId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "purchase_request_id", nullable = false, updatable = false)
    private UUID purchaseRequestId;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "commission_rate", nullable = false, updatable = false, precision = 6, scale = 4)
    private BigDecimal commissionRate;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "net_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    @Column(name = "paid_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal paidAmount;

    @Column(name = "remaining_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal remainingBalance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "completed_at")
    private Instant completedAt;

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

    static TransactionEntity fromDomain(Transaction transaction) {
        return new TransactionEntity(
            transaction.getId(),
            transaction.getTransactionNumber(),
            transaction.getMerchantId(),
            transaction.getCustomerId(),
            transaction.getPurchaseRequestId(),
            transaction.getTotalAmount(),
            transaction.getCommissionRate(),
            transaction.getCommissionAmount(),
            transaction.getNetAmount(),
            transaction.getPaidAmount(),
            transaction.getRemainingBalance(),
            transaction.getStatus(),
            transaction.getDueDate(),
            transaction.getCompletedAt(),
            null,
            transaction.getCreatedAt(),
            transaction.getUpdatedAt()
        );
    }

    public Transaction toDomain() {
        return new Transaction(id, transactionNumber, merchantId, customerId, purchaseRequestId, totalAmount,
            commissionRate, commissionAmount, netAmount, paidAmount, remainingBalance, status, dueDate,
            completedAt, createdAt, updatedAt);
    }

    void updateFromDomain(Transaction transaction) {
        this.paidAmount = transaction.getPaidAmount();
        this.remainingBalance = transaction.getRemainingBalance();
        this.status = transaction.getStatus();
        this.completedAt = transaction.getCompletedAt();
    }
}
