package com.flagship.bnpl_ledger.credit;

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

/**
 * JPA entity for customers.
 *
 * No setters: balances change only through {@link #updateFromDomain(Customer)} with a domain
 * object that has already passed its invariant check. {@code version} catches any write that
 * did not hold the row lock.
 */
@Entity
@Table(name = "customers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CustomerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_code", nullable = false, updatable = false, length = 8)
    private String customerCode;

    @Column(name = "credit_limit", nullable = false, precision = 19, scale = 2)
    private BigDecimal creditLimit;

    @Column(name = "available_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal availableBalance;

    @Column(name = "outstanding_balance", nullable = false, precision = 19, scale = 2)
    private BigDecimal outstandingBalance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CustomerStatus status;

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

    static CustomerEntity fromDomain(Customer customer) {
        return new CustomerEntity(
            customer.getId(),
            customer.getCustomerCode(),
            customer.getCreditLimit(),
            customer.getAvailableBalance(),
            customer.getOutstandingBalance(),
            customer.getStatus(),
            null, // version - assigned on insert
            customer.getCreatedAt(),
            customer.getUpdatedAt()
        );
    }

    public Customer toDomain() {
        return new Customer(id, customerCode, creditLimit, availableBalance, outstandingBalance,
            status, createdAt, updatedAt);
    }

    void updateFromDomain(Customer customer) {
        this.creditLimit = customer.getCreditLimit();
        this.availableBalance = customer.getAvailableBalance();
        this.outstandingBalance = customer.getOutstandingBalance();
        this.status = customer.getStatus();
    }
}
