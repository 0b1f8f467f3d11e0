package com.flagship.bnpl_ledger.transaction;

import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.installment.InstallmentStatus;
import com.flagship.bnpl_ledger.installment.RepaymentPlanService;
import com.flagship.bnpl_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Persistence and reads for transactions.
 *
 * Reads present a transaction with a past-due installment as OVERDUE whether or not the
 * maintenance sweep has written that status yet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private static final List<InstallmentStatus> UNSETTLED = List.of(InstallmentStatus.PENDING, InstallmentStatus.OVERDUE);

    private final TransactionRepository repository;
    private final RepaymentPlanService planService;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction open(Transaction transaction) {
        repository.save(TransactionEntity.fromDomain(transaction));
        CorrelationContext.putEntity(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId());
        log.info("Opened transaction {} for {} (commission {}, net {})", transaction.getTransactionNumber(),
            transaction.getTotalAmount(), transaction.getCommissionAmount(), transaction.getNetAmount());
        return transaction;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction lockTransaction(UUID transactionId) {
        CorrelationContext.putEntity(CorrelationContext.TRANSACTION_ID_MDC_KEY, transactionId);
        return lockEntity(transactionId).toDomain();
    }

    /**
     * Applies a payment to the locked transaction row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Transaction recordPayment(UUID transactionId, BigDecimal amount, boolean stillOverdue) {
        TransactionEntity entity = lockEntity(transactionId);
        Transaction updated = entity.toDomain().applyPayment(amount, stillOverdue, clock.instant());
        entity.updateFromDomain(updated);
        repository.save(entity);
        return updated;
    }

    /**
     * Writes OVERDUE on past-due rows of one transaction and on the transaction itself.
     *
     * @return whether anything changed
     */
    @Transactional
    public boolean flagOverdue(UUID transactionId) {
        LocalDate today = LocalDate.now(clock);
        Instant now = clock.instant();
        TransactionEntity entity = lockEntity(transactionId);
        Transaction transaction = entity.toDomain();
        if (!transaction.getStatus().acceptsPayments()) {
            return false;
        }

        int flagged = planService.flagOverdueRows(transactionId, today);
        if (flagged > 0 && transaction.getStatus() == TransactionStatus.ACTIVE) {
            entity.updateFromDomain(transaction.markOverdue(now));
            repository.save(entity);
        }
        if (flagged > 0) {
            log.info("Flagged {} overdue installments on transaction {}", flagged, transaction.getTransactionNumber());
        }
        return flagged > 0;
    }

    @Transactional(readOnly = true)
    public List<UUID> findWithInstallmentsPastDue() {
        return planService.transactionsWithRowsPastDue(LocalDate.now(clock));
    }

    @Transactional(readOnly = true)
    public Transaction getTransaction(UUID transactionId) {
        TransactionEntity entity = repository.findById(transactionId)
            .orElseThrow(() -> new ResourceNotFoundException("Transaction", transactionId));
        return present(List.of(entity), null).get(0);
    }

    @Transactional(readOnly = true)
    public List<Transaction> transactionsForCustomer(UUID customerId, TransactionStatus status) {
        return present(repository.findByCustomerIdOrderByCreatedAtDesc(customerId), status);
    }

    @Transactional(readOnly = true)
    public List<Transaction> transactionsForMerchant(UUID merchantId, TransactionStatus status) {
        return present(repository.findByMerchantIdOrderByCreatedAtDesc(merchantId), status);
    }

    private List<Transaction> present(List<TransactionEntity> entities, TransactionStatus status) {
        if (entities.isEmpty()) {
            return List.of();
        }
        List<UUID> ids = entities.stream().map(TransactionEntity::getId).toList();
        Set<UUID> overdue = new HashSet<>(
            repository.findIdsWithInstallmentsDueBefore(ids, UNSETTLED, LocalDate.now(clock)));
        return entities.stream()
            .map(entity -> entity.toDomain().presented(overdue.contains(entity.getId())))
            .filter(transaction -> status == null || transaction.getStatus() == status)
            .toList();
    }

    private TransactionEntity lockEntity(UUID transactionId) {
        return repository.findByIdForUpdate(transactionId)
            .orElseThrow(() -> new ResourceNotFoundException("Transaction", transactionId));
    }
}
