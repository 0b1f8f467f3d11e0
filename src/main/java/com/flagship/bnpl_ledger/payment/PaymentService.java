package com.flagship.bnpl_ledger.payment;

import com.flagship.bnpl_ledger.credit.CreditLedgerService;
import com.flagship.bnpl_ledger.event.InstallmentPaymentRecordedEvent;
import com.flagship.bnpl_ledger.event.TransactionCompletedEvent;
import com.flagship.bnpl_ledger.exception.ForbiddenOperationException;
import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.installment.PlanSchedule;
import com.flagship.bnpl_ledger.installment.RepaymentPlan;
import com.flagship.bnpl_ledger.installment.RepaymentPlanService;
import com.flagship.bnpl_ledger.money.Money;
import com.flagship.bnpl_ledger.observability.CorrelationContext;
import com.flagship.bnpl_ledger.observability.LedgerMetrics;
import com.flagship.bnpl_ledger.outbox.OutboxService;
import com.flagship.bnpl_ledger.reference.ReferenceGenerator;
import com.flagship.bnpl_ledger.transaction.Transaction;
import com.flagship.bnpl_ledger.transaction.TransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records installment payments.
 *
 * One payment runs in one database transaction holding, in this order, the transaction row,
 * the plan and its schedule rows, and the customer row. It distributes the amount oldest
 * installment first, releases the same amount of credit to the customer and writes the
 * payment, its allocations and the outbox events. Any failure rolls all of it back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final PaymentAllocationRepository allocationRepository;
    private final PaymentApplicationEngine engine;
    private final IdempotencyService idempotencyService;
    private final TransactionService transactionService;
    private final RepaymentPlanService planService;
    private final CreditLedgerService creditLedgerService;
    private final ReferenceGenerator referenceGenerator;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Applies a payment to a transaction.
     *
     * @param idempotencyKey optional; a repeated key returns the payment it created the first time
     * @throws com.flagship.bnpl_ledger.exception.InvalidAmountException if the amount is not positive,
     *         has more than two decimals or exceeds the remaining balance
     * @throws com.flagship.bnpl_ledger.exception.TransactionNotActiveException unless the transaction is ACTIVE or OVERDUE
     * @throws ForbiddenOperationException if {@code customerId} does not own the transaction
     */
    @Transactional
    public PaymentResult makePayment(UUID transactionId, UUID customerId, BigDecimal amount,
                                     PaymentMethod method, String idempotencyKey) {
        if (method == null) {
            throw new LedgerValidationException("Payment method is required");
        }
        String key = idempotencyKey != null && !idempotencyKey.isBlank() ? idempotencyKey : null;
        if (key != null) {
            Optional<UUID> existing = idempotencyService.lookup(key);
            if (existing.isPresent()) {
                return replay(existing.get(), transactionId, customerId);
            }
            ledgerMetrics.recordIdempotencyMiss();
        }
        BigDecimal value = Money.positive(amount, "Payment amount");

        Transaction transaction = transactionService.lockTransaction(transactionId);
        if (!transaction.getCustomerId().equals(customerId)) {
            throw new ForbiddenOperationException(
                "Customer " + customerId + " does not own transaction " + transactionId);
        }
        CorrelationContext.putEntity(CorrelationContext.CUSTOMER_ID_MDC_KEY, customerId);

        // A concurrent request with the same key may have committed while we waited for the lock
        if (key != null) {
            Optional<UUID> committed = idempotencyService.findInDatabase(key);
            if (committed.isPresent()) {
                return replay(committed.get(), transactionId, customerId);
            }
        }
        transaction.validatePayment(value);

        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);
        UUID paymentId = UUID.randomUUID();

        PlanSchedule schedule = planService.lockPlan(transactionId);
        PaymentApplication application = engine.apply(schedule.getRows(), value, paymentId, now);
        RepaymentPlan plan = planService.recordPayment(schedule.getPlan().getId(), value, application.getRows());
        Transaction updated = transactionService.recordPayment(transactionId, value, application.hasOverdueRows(today));
        if (plan.isCompleted() != updated.isCompleted()) {
            throw new InvariantViolationException(String.format(
                "Transaction %s is %s but its plan is %s",
                updated.getTransactionNumber(), updated.getStatus(), plan.getStatus()));
        }

        creditLedgerService.release(customerId, value);

        Payment payment = Payment.completed(paymentId, referenceGenerator.payment(), transactionId, customerId,
            value, method, application.installmentsCovered(), key, now);
        paymentRepository.save(PaymentEntity.fromDomain(payment));
        allocationRepository.saveAll(application.getAllocations().stream()
            .map(PaymentAllocationEntity::fromDomain)
            .toList());

        outboxService.saveEvent(InstallmentPaymentRecordedEvent.from(payment, updated));
        if (updated.isCompleted()) {
            outboxService.saveEvent(TransactionCompletedEvent.from(updated));
        }
        if (key != null) {
            idempotencyService.rememberAfterCommit(key, paymentId);
        }
        ledgerMetrics.recordPaymentApplied(method.name(), updated.isCompleted());

        log.info("Payment {} of {} applied to {} installment(s) of {}: paid={}, remaining={}, status={}",
            payment.getReferenceNumber(), value, payment.getInstallmentsCovered(),
            updated.getTransactionNumber(), updated.getPaidAmount(), updated.getRemainingBalance(),
            updated.getStatus());
        return new PaymentResult(payment, application.getAllocations(), updated, false);
    }

    @Transactional(readOnly = true)
    public PaymentResult getPayment(UUID paymentId) {
        Payment payment = paymentRepository.findById(paymentId)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
        return new PaymentResult(payment, allocations(paymentId),
            transactionService.getTransaction(payment.getTransactionId()), false);
    }

    @Transactional(readOnly = true)
    public List<Payment> paymentsForTransaction(UUID transactionId) {
        return paymentRepository.findByTransactionIdOrderByCreatedAtAsc(transactionId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> paymentsForCustomer(UUID customerId) {
        return paymentRepository.findByCustomerIdOrderByCreatedAtDesc(customerId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    private PaymentResult replay(UUID paymentId, UUID transactionId, UUID customerId) {
        Payment payment = paymentRepository.findById(paymentId)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException(
                "Payment found by idempotency key but not found by id: " + paymentId));
        if (!payment.getTransactionId().equals(transactionId) || !payment.getCustomerId().equals(customerId)) {
            throw new LedgerValidationException(
                "Idempotency key was already used for a different transaction or customer");
        }
        ledgerMetrics.recordIdempotencyHit();
        log.info("Idempotency key already used, returning payment {}", payment.getReferenceNumber());
        return new PaymentResult(payment, allocations(paymentId),
            transactionService.getTransaction(transactionId), true);
    }

    private List<PaymentAllocation> allocations(UUID paymentId) {
        return allocationRepository.findByPaymentIdOrderByInstallmentNumberAsc(paymentId).stream()
            .map(PaymentAllocationEntity::toDomain)
            .toList();
    }
}
