package com.flagship.bnpl_ledger.settlement;

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
@Table(name = "settlements")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "settlement_reference", nullable = false, updatable = false, length = 40)
    private String settlementReference;

    @Column(name = "merchant_id", nullable = false, updatable = false)
    private UUID merchantId;

    @Column(name = "transaction_id", updatable = false)
    private UUID transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "settlement_type", nullable = false, updatable = false, length = 20)
    private SettlementType settlementType;

    @Column(name = "gross_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal grossAmount;

    @Column(name = "commission_rate", nullable = false, updatable = false, precision = 6, scale = 4)
    private BigDecimal commissionRate;

    @Column(name = "commission_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "net_amount", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SettlementStatus status;

    @Column(name = "bank_name", updatable = false)
    private String bankName;

    @Column(name = "bank_account", updatable = false, length = 64)
    private String bankAccount;

    @Column(updatable = false, length = 34)
    private String iban;

    @Column(name = "bank_reference", length = 100)
    private String bankReference;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "processed_at")
    private Instant processedAt;

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

    static SettlementEntity fromDomain(Settlement settlement) {
        BankDetails bank = settlement.getBankDetails();
        return new SettlementEntity(
            settlement.getId(),
            settlement.getSettlementReference(),
            settlement.getMerchantId(),
            settlement.getTransactionId(),
            settlement.getSettlementType(),
            settlement.getGrossAmount(),
            settlement.getCommissionRate(),
            settlement.getCommissionAmount(),
            settlement.getNetAmount(),
            settlement.getStatus(),
            bank != null ? bank.getBankName() : null,
            bank != null ? bank.getBankAccount() : null,
            bank != null ? bank.getIban() : null,
            settlement.getBankReference(),
            settlement.getFailureReason(),
            settlement.getProcessedAt(),
            settlement.getCompletedAt(),
            null,
            settlement.getCreatedAt(),
            settlement.getUpdatedAt()
        );
    }

    public Settlement toDomain() {
        BankDetails bank = bankName != null ? new BankDetails(bankName, bankAccount, iban) : null;
        return new Settlement(id, settlementReference, merchantId, transactionId, settlementType, grossAmount,
            commissionRate, commissionAmount, netAmount, status, bank, bankReference, failureReason,
            processedAt, completedAt, createdAt, updatedAt);
    }

    void updateFromDomain(Settlement settlement) {
        this.status = settlement.getStatus();
        this.bankReference = settlement.getBankReference();
        this.failureReason = settlement.getFailureReason();
        this.processedAt = settlement.getProcessedAt();
        this.completedAt = settlement.getCompletedAt();
    }
}
