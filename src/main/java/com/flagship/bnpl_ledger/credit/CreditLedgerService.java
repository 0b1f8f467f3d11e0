package com.flagship.bnpl_ledger.credit;

import com.flagship.bnpl_ledger.config.LedgerProperties;
import com.flagship.bnpl_ledger.event.CreditLimitChangedEvent;
import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.exception.LimitExceedsMaxException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.money.Money;
import com.flagship.bnpl_ledger.observability.CorrelationContext;
import com.flagship.bnpl_ledger.observability.LedgerMetrics;
import com.flagship.bnpl_ledger.outbox.OutboxService;
import com.flagship.bnpl_ledger.reference.ReferenceGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Owns every change to a customer's credit position.
 *
 * Balance changes always load the customer row with {@code SELECT ... FOR UPDATE}, apply the
 * change on the immutable {@link Customer} (which re-checks the conservation invariant) and write
 * it back in the caller's transaction. {@link #reserve} and {@link #release} require an existing
 * transaction: they are steps of the accept and payment flows, never standalone operations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditLedgerService {

    private static final int CODE_ATTEMPTS = 5;

    private final CustomerRepository customerRepository;
    private final CustomerLimitHistoryRepository limitHistoryRepository;
    private final ReferenceGenerator referenceGenerator;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final LedgerProperties properties;
    private final Clock clock;

    /**
     * Registers a customer with the given limit, or the default limit when {@code creditLimit} is null.
     */
    @Transactional
    public Customer registerCustomer(BigDecimal creditLimit) {
        BigDecimal limit = creditLimit != null ? Money.of(creditLimit) : properties.getDefaultCreditLimit();
        if (limit.signum() < 0) {
            throw new LedgerValidationException("Credit limit cannot be negative");
        }
        if (limit.compareTo(properties.getMaxCreditLimit()) > 0) {
            throw new LimitExceedsMaxException(limit, properties.getMaxCreditLimit());
        }

        Customer customer = Customer.register(UUID.randomUUID(), uniqueCustomerCode(), limit, clock.instant());
        customerRepository.save(CustomerEntity.fromDomain(customer));

        log.info("Registered customer {} ({}) with credit limit {}",
            customer.getId(), customer.getCustomerCode(), limit);
        return customer;
    }

    @Transactional(readOnly = true)
    public Customer getCustomer(UUID customerId) {
        return customerRepository.findById(customerId)
            .map(CustomerEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    }

    /**
     * Locks the customer row for the rest of the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Customer lockCustomer(UUID customerId) {
        return lockEntity(customerId).toDomain();
    }

    /**
     * Moves {@code amount} from available to outstanding.
     *
     * @throws com.flagship.bnpl_ledger.exception.InsufficientCreditException if available credit is too low
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Customer reserve(UUID customerId, BigDecimal amount) {
        CustomerEntity entity = lockEntity(customerId);
        Customer reserved = entity.toDomain().reserve(amount, clock.instant());
        entity.updateFromDomain(reserved);
        customerRepository.save(entity);

        ledgerMetrics.recordCreditReserved(amount);
        log.info("Reserved {} of credit for customer {}: available={}, outstanding={}",
            amount, customerId, reserved.getAvailableBalance(), reserved.getOutstandingBalance());
        return reserved;
    }

    /**
     * Moves {@code amount} from outstanding back to available.
     *
     * @throws com.flagship.bnpl_ledger.exception.InvariantViolationException if it exceeds the outstanding balance
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Customer release(UUID customerId, BigDecimal amount) {
        CustomerEntity entity = lockEntity(customerId);
        Customer released = entity.toDomain().release(amount, clock.instant());
        entity.updateFromDomain(released);
        customerRepository.save(entity);

        ledgerMetrics.recordCreditReleased(amount);
        log.info("Released {} of credit for customer {}: available={}, outstanding={}",
            amount, customerId, released.getAvailableBalance(), released.getOutstandingBalance());
        return released;
    }

    /**
     * Requests a higher credit limit.
     *
     * Limits up to the auto-approve ceiling are applied immediately; higher ones are recorded
     * as PENDING for an administrator. Either way a history entry is written.
     */
    @Transactional
    public CustomerLimitHistory requestLimitIncrease(UUID customerId, BigDecimal newLimit, String reason) {
        BigDecimal requested = Money.positive(newLimit, "New credit limit");
        if (requested.compareTo(properties.getMaxCreditLimit()) > 0) {
            throw new LimitExceedsMaxException(requested, properties.getMaxCreditLimit());
        }

        CorrelationContext.putEntity(CorrelationContext.CUSTOMER_ID_MDC_KEY, customerId);
        CustomerEntity entity = lockEntity(customerId);
        Customer customer = entity.toDomain();
        if (requested.compareTo(customer.getCreditLimit()) <= 0) {
            throw new LedgerValidationException(String.format(
                "New limit %s must be greater than current limit %s",
                requested.toPlainString(), customer.getCreditLimit().toPlainString()));
        }

        Instant now = clock.instant();
        CustomerLimitHistory history;
        if (requested.compareTo(properties.getAutoApproveLimit()) <= 0) {
            Customer raised = customer.raiseLimit(requested, now);
            entity.updateFromDomain(raised);
            customerRepository.save(entity);
            history = CustomerLimitHistory.autoApproved(customerId, customer.getCreditLimit(), requested, reason, now);
            log.info("Auto-approved credit limit increase {} -> {}", customer.getCreditLimit(), requested);
        } else {
            boolean alreadyPending = limitHistoryRepository.findByCustomerIdOrderByCreatedAtDesc(customerId)
                .stream()
                .anyMatch(h -> h.getStatus() == LimitRequestStatus.PENDING);
            if (alreadyPending) {
                throw new InvalidStateException("Customer " + customerId + " already has a limit request awaiting review");
            }
            history = CustomerLimitHistory.pending(customerId, customer.getCreditLimit(), requested, reason, now);
            log.info("Credit limit increase to {} recorded for admin review", requested);
        }

        limitHistoryRepository.save(CustomerLimitHistoryEntity.fromDomain(history));
        outboxService.saveEvent(CreditLimitChangedEvent.from(history, now));
        return history;
    }

    /**
     * Approves a pending limit request. The request is re-validated against the customer's
     * current limit, which may have changed since it was filed.
     */
    @Transactional(noRollbackFor = InvalidStateException.class)
    public CustomerLimitHistory approveLimitIncrease(UUID historyId, String approver, String note) {
        CustomerLimitHistoryEntity historyEntity = limitHistoryRepository.findByIdForUpdate(historyId)
            .orElseThrow(() -> new ResourceNotFoundException("Limit request", historyId));
        CustomerLimitHistory history = historyEntity.toDomain();
        if (!history.isPending()) {
            throw new InvalidStateException(String.format(
                "Cannot approve limit request %s in %s status", historyId, history.getStatus()));
        }

        Instant now = clock.instant();
        CustomerEntity customerEntity = lockEntity(history.getCustomerId());
        Customer customer = customerEntity.toDomain();

        if (history.getRequestedLimit().compareTo(customer.getCreditLimit()) <= 0) {
            CustomerLimitHistory stale = history.reject(approver,
                "Requested limit no longer exceeds current limit " + customer.getCreditLimit().toPlainString(), now);
            historyEntity.updateFromDomain(stale);
            limitHistoryRepository.save(historyEntity);
            throw new InvalidStateException(String.format(
                "Limit request %s is stale: requested %s, current limit %s",
                historyId, history.getRequestedLimit().toPlainString(), customer.getCreditLimit().toPlainString()));
        }

        Customer raised = customer.raiseLimit(history.getRequestedLimit(), now);
        customerEntity.updateFromDomain(raised);
        customerRepository.save(customerEntity);

        CustomerLimitHistory approved = history.approve(customer.getCreditLimit(), approver, note, now);
        historyEntity.updateFromDomain(approved);
        limitHistoryRepository.save(historyEntity);
        outboxService.saveEvent(CreditLimitChangedEvent.from(approved, now));

        log.info("Limit request {} approved by {}: {} -> {}",
            historyId, approver, customer.getCreditLimit(), raised.getCreditLimit());
        return approved;
    }

    @Transactional
    public CustomerLimitHistory rejectLimitIncrease(UUID historyId, String approver, String note) {
        CustomerLimitHistoryEntity historyEntity = limitHistoryRepository.findByIdForUpdate(historyId)
            .orElseThrow(() -> new ResourceNotFoundException("Limit request", historyId));

        Instant now = clock.instant();
        CustomerLimitHistory rejected = historyEntity.toDomain().reject(approver, note, now);
        historyEntity.updateFromDomain(rejected);
        limitHistoryRepository.save(historyEntity);
        outboxService.saveEvent(CreditLimitChangedEvent.from(rejected, now));

        log.info("Limit request {} rejected by {}", historyId, approver);
        return rejected;
    }

    @Transactional
    public Customer changeStatus(UUID customerId, CustomerStatus status) {
        if (status == null) {
            throw new LedgerValidationException("Status is required");
        }
        CustomerEntity entity = lockEntity(customerId);
        Customer previous = entity.toDomain();
        Customer updated = previous.withStatus(status, clock.instant());
        entity.updateFromDomain(updated);
        customerRepository.save(entity);

        log.info("Customer {} status changed {} -> {}", customerId, previous.getStatus(), status);
        return updated;
    }

    @Transactional(readOnly = true)
    public List<CustomerLimitHistory> limitHistory(UUID customerId) {
        return limitHistoryRepository.findByCustomerIdOrderByCreatedAtDesc(customerId)
            .stream()
            .map(CustomerLimitHistoryEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<CustomerLimitHistory> pendingLimitRequests() {
        return limitHistoryRepository.findByStatusOrderByCreatedAtAsc(LimitRequestStatus.PENDING)
            .stream()
            .map(CustomerLimitHistoryEntity::toDomain)
            .toList();
    }

    private CustomerEntity lockEntity(UUID customerId) {
        return customerRepository.findByIdForUpdate(customerId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    }

    private String uniqueCustomerCode() {
        for (int attempt = 0; attempt < CODE_ATTEMPTS; attempt++) {
            String code = referenceGenerator.customerCode();
            if (!customerRepository.existsByCustomerCode(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not generate a unique customer code after " + CODE_ATTEMPTS + " attempts");
    }
}
