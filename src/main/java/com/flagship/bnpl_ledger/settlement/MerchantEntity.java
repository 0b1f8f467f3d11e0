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
@Table(name = "merchants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MerchantEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_name", nullable = false)
    private String businessName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MerchantStatus status;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal balance;

    @Column(name = "total_commission_paid", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalCommissionPaid;

    @Column(name = "total_transactions", nullable = false)
    private int totalTransactions;

    @Column(name = "total_volume", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalVolume;

    @Column(name = "bank_name")
    private String bankName;

    @Column(name = "bank_account", length = 64)
    private String bankAccount;

    @Column(length = 34)
    private String iban;

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

    static MerchantEntity fromDomain(Merchant merchant) {
        BankDetails bank = merchant.getBankDetails();
        return new MerchantEntity(
            merchant.getId(),
            merchant.getBusinessName(),
            merchant.getStatus(),
            merchant.getBalance(),
            merchant.getTotalCommissionPaid(),
            merchant.getTotalTransactions(),
            merchant.getTotalVolume(),
            bank != null ? bank.getBankName() : null,
            bank != null ? bank.getBankAccount() : null,
            bank != null ? bank.getIban() : null,
            null,
            merchant.getCreatedAt(),
            merchant.getUpdatedAt()
        );
    }

    public Merchant toDomain() {
        BankDetails bank = bankName != null ? new BankDetails(bankName, bankAccount, iban) : null;
        return new Merchant(id, businessName, status, balance, totalCommissionPaid, totalTransactions,
            totalVolume, bank, createdAt, updatedAt);
    }

    void updateFromDomain(Merchant merchant) {
        this.status = merchant.getStatus();
        this.balance = merchant.getBalance();
        this.totalCommissionPaid = merchant.getTotalCommissionPaid();
        this.totalTransactions = merchant.getTotalTransactions();
        this.totalVolume = merchant.getTotalVolume();
        BankDetails bank = merchant.getBankDetails();
        if (bank != null) {
            this.bankName = bank.getBankName();
            this.bankAccount = bank.getBankAccount();
            this.iban = bank.getIban();
        }
    }
}
