package com.flagship.bnpl_ledger.payment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payments.
 *
 * Payments are append-only: every column is {@code updatable = false} and there is no update path.
 * The idempotency key is unique in the table, which is the final guard against a double apply.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "reference_number", nullable = false, updatable = false, length = 40)
    private String referenceNumber;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private UUID transactionId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, updatable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "installments_covered", nullable = false, updatable = false)
    private int installmentsCovered;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    static PaymentEntity fromDomain(Payment payment) {
        return new PaymentEntity(
            payment.getId(),
            payment.getReferenceNumber(),
            payment.getTransactionId(),
            payment.getCustomerId(),
            payment.getAmount(),
            payment.getPaymentMethod(),
            payment.getStatus(),
            payment.getInstallmentsCovered(),
            payment.getIdempotencyKey(),
            payment.getCreatedAt()
        );
    }

    public Payment toDomain() {
        return new Payment(id, referenceNumber, transactionId, customerId, amount, paymentMethod, status,
            installmentsCovered, idempotencyKey, createdAt);
    }
}
