package com.flagship.bnpl_ledger.credit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "customer_limit_history")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CustomerLimitHistoryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "previous_limit", nullable = false, precision = 19, scale = 2)
    private BigDecimal previousLimit;

    @Column(name = "requested_limit", nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal requestedLimit;

    @Column(name = "new_limit", nullable = false, precision = 19, scale = 2)
    private BigDecimal newLimit;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LimitRequestStatus status;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(name = "decided_by", length = 100)
    private String decidedBy;

    @Column(name = "decision_note", columnDefinition = "TEXT")
    private String decisionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "decided_at")
    private Instant decidedAt;

    static CustomerLimitHistoryEntity fromDomain(CustomerLimitHistory history) {
        return new CustomerLimitHistoryEntity(
            history.getId(),
            history.getCustomerId(),
            history.getPreviousLimit(),
            history.getRequestedLimit(),
            history.getNewLimit(),
            history.getStatus(),
            history.getReason(),
            history.getDecidedBy(),
            history.getDecisionNote(),
            history.getCreatedAt(),
            history.getDecidedAt()
        );
    }

    public CustomerLimitHistory toDomain() {
        return new CustomerLimitHistory(id, customerId, previousLimit, requestedLimit, newLimit, status,
            reason, decidedBy, decisionNote, createdAt, decidedAt);
    }

    void updateFromDomain(CustomerLimitHistory history) {
        this.previousLimit = history.getPreviousLimit();
        this.newLimit = history.getNewLimit();
        this.status = history.getStatus();
        this.decidedBy = history.getDecidedBy();
        this.decisionNote = history.getDecisionNote();
        this.decidedAt = history.getDecidedAt();
    }
}
