package com.flagship.bnpl_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.purchase_requests: requests by outcome (created, accepted, rejected, cancelled, expired)
 * - ledger.payments: applied payments by method
 * - ledger.credit.amount: reserved and released credit (distribution summary, tagged by direction)
 * - ledger.settlements: income accruals and withdrawals by status
 * - ledger.rejections: business-rule and validation rejections by error code
 * - ledger.invariant_violations: should stay at zero
 * - ledger.operation.latency: latency per operation and outcome
 * - ledger.backlog: pending limit requests, open withdrawals and past-due installments,
 *   refreshed by {@link MetricsScheduler}
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter invariantViolations;
    private final Counter idempotencyHits;
    private final Counter idempotencyMisses;
    private final AtomicLong pendingLimitRequests = new AtomicLong();
    private final AtomicLong openWithdrawals = new AtomicLong();
    private final AtomicLong pastDueInstallments = new AtomicLong();

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.invariantViolations = Counter.builder("ledger.invariant_violations")
                .description("Ledger invariant violations (bugs or data corruption)")
                .register(registry);
        this.idempotencyHits = Counter.builder("idempotency.cache")
                .tag("result", "hit")
                .description("Payment requests answered from an existing idempotency key")
                .register(registry);
        this.idempotencyMisses = Counter.builder("idempotency.cache")
                .tag("result", "miss")
                .register(registry);

        Gauge.builder("ledger.backlog", pendingLimitRequests, AtomicLong::get)
                .tag("kind", "pending_limit_requests")
                .register(registry);
        Gauge.builder("ledger.backlog", openWithdrawals, AtomicLong::get)
                .tag("kind", "open_withdrawals")
                .register(registry);
        Gauge.builder("ledger.backlog", pastDueInstallments, AtomicLong::get)
                .tag("kind", "past_due_installments")
                .register(registry);
    }

    public void updateBacklog(long limitRequests, long withdrawals, long pastDue) {
        pendingLimitRequests.set(limitRequests);
        openWithdrawals.set(withdrawals);
        pastDueInstallments.set(pastDue);
    }

    public long pendingLimitRequests() {
        return pendingLimitRequests.get();
    }

    public long openWithdrawals() {
        return openWithdrawals.get();
    }

    public long pastDueInstallments() {
        return pastDueInstallments.get();
    }

    public void recordPurchaseRequest(String outcome) {
        registry.counter("ledger.purchase_requests", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordPaymentApplied(String method, boolean completedTransaction) {
        registry.counter("ledger.payments",
                "method", sanitizeTag(method),
                "completed_transaction", String.valueOf(completedTransaction)
        ).increment();
    }

    public void recordCreditReserved(BigDecimal amount) {
        creditSummary("reserve").record(amount.doubleValue());
    }

    public void recordCreditReleased(BigDecimal amount) {
        creditSummary("release").record(amount.doubleValue());
    }

    public void recordSettlement(String type, String status) {
        registry.counter("ledger.settlements",
                "type", sanitizeTag(type),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordRejection(String errorCode) {
        registry.counter("ledger.rejections", "code", sanitizeTag(errorCode)).increment();
    }

    public void recordInvariantViolation() {
        invariantViolations.increment();
    }

    public void recordIdempotencyHit() {
        idempotencyHits.increment();
    }

    public void recordIdempotencyMiss() {
        idempotencyMisses.increment();
    }

    public void recordConcurrencyRetry(String operation) {
        registry.counter("ledger.concurrency.retries", "operation", sanitizeTag(operation)).increment();
    }

    public void recordLatency(String operation, String outcome, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(Duration.ofMillis(durationMs));
    }

    private DistributionSummary creditSummary(String direction) {
        return DistributionSummary.builder("ledger.credit.amount")
                .tag("direction", direction)
                .baseUnit("currency")
                .register(registry);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
