package com.flagship.bnpl_ledger.purchase;

import com.flagship.bnpl_ledger.config.LedgerProperties;
import com.flagship.bnpl_ledger.credit.CreditLedgerService;
import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.event.PurchaseRequestClosedEvent;
import com.flagship.bnpl_ledger.event.PurchaseRequestCreatedEvent;
import com.flagship.bnpl_ledger.exception.ForbiddenOperationException;
import com.flagship.bnpl_ledger.exception.InsufficientCreditException;
import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.RequestExpiredException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.observability.CorrelationContext;
import com.flagship.bnpl_ledger.observability.LedgerMetrics;
import com.flagship.bnpl_ledger.outbox.OutboxService;
import com.flagship.bnpl_ledger.reference.ReferenceGenerator;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.settlement.MerchantService;
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
 * Purchase request lifecycle: send, reject, cancel, expire.
 *
 * Accepting lives in the orchestration layer because it touches every other ledger; it uses
 * {@link #lockForCustomer(UUID, UUID)} and {@link #markAccepted(UUID, UUID)} from here.
 *
 * Write paths that find an expired PENDING request persist EXPIRED and then throw
 * {@link RequestExpiredException}. Their transactions are declared {@code noRollbackFor} that
 * exception so the flip is kept.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseRequestService {

    private final PurchaseRequestRepository repository;
    private final CreditLedgerService creditLedgerService;
    private final MerchantService merchantService;
    private final ReferenceGenerator referenceGenerator;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final LedgerProperties properties;
    private final Clock clock;

    @Transactional
    public PurchaseRequest sendPurchaseRequest(UUID merchantId, UUID customerId, String productName,
                                               String productDescription, int quantity, BigDecimal unitPrice) {
        Instant now = clock.instant();
        PurchaseRequest request = PurchaseRequest.create(referenceGenerator.purchaseRequest(), merchantId, customerId,
            productName, productDescription, quantity, unitPrice, now, properties.getRequestExpiry());

        CorrelationContext.putEntity(CorrelationContext.MERCHANT_ID_MDC_KEY, merchantId);
        CorrelationContext.putEntity(CorrelationContext.CUSTOMER_ID_MDC_KEY, customerId);

        Merchant merchant = merchantService.getMerchant(merchantId);
        if (!merchant.isActive()) {
            throw new InvalidStateException("Merchant " + merchantId + " is " + merchant.getStatus());
        }
        Customer customer = creditLedgerService.getCustomer(customerId);
        if (!customer.isActive()) {
            throw new InvalidStateException("Customer " + customerId + " is " + customer.getStatus());
        }
        if (customer.getAvailableBalance().compareTo(request.getTotalAmount()) < 0) {
            throw new InsufficientCreditException(customerId, request.getTotalAmount(), customer.getAvailableBalance());
        }

        repository.save(PurchaseRequestEntity.fromDomain(request));
        outboxService.saveEvent(PurchaseRequestCreatedEvent.from(request));
        ledgerMetrics.recordPurchaseRequest("created");

        CorrelationContext.putEntity(CorrelationContext.REQUEST_ID_MDC_KEY, request.getId());
        log.info("Purchase request {} sent: {} x {} = {}, expires at {}",
            request.getReferenceNumber(), quantity, request.getUnitPrice(), request.getTotalAmount(),
            request.getExpiresAt());
        return request;
    }

    @Transactional(noRollbackFor = RequestExpiredException.class)
    public PurchaseRequest rejectPurchase(UUID requestId, UUID customerId, String reason) {
        Instant now = clock.instant();
        PurchaseRequestEntity entity = lockOpen(requestId, customerId, null, now);
        PurchaseRequest rejected = entity.toDomain().reject(reason, now);
        entity.updateFromDomain(rejected);
        repository.save(entity);
        outboxService.saveEvent(PurchaseRequestClosedEvent.from(rejected, now));
        ledgerMetrics.recordPurchaseRequest("rejected");

        log.info("Purchase request {} rejected by customer", rejected.getReferenceNumber());
        return rejected;
    }

    @Transactional(noRollbackFor = RequestExpiredException.class)
    public PurchaseRequest cancelPurchase(UUID requestId, UUID merchantId) {
        Instant now = clock.instant();
        PurchaseRequestEntity entity = lockOpen(requestId, null, merchantId, now);
        PurchaseRequest cancelled = entity.toDomain().cancel(now);
        entity.updateFromDomain(cancelled);
        repository.save(entity);
        outboxService.saveEvent(PurchaseRequestClosedEvent.from(cancelled, now));
        ledgerMetrics.recordPurchaseRequest("cancelled");

        log.info("Purchase request {} cancelled by merchant", cancelled.getReferenceNumber());
        return cancelled;
    }

    /**
     * Locks a PENDING, unexpired request on behalf of its customer.
     *
     * @throws ForbiddenOperationException if {@code customerId} is not the request's customer
     * @throws InvalidStateException if the request is already terminal
     * @throws RequestExpiredException after persisting EXPIRED
     */
    @Transactional(propagation = Propagation.MANDATORY, noRollbackFor = RequestExpiredException.class)
    public PurchaseRequest lockForCustomer(UUID requestId, UUID customerId) {
        return lockOpen(requestId, customerId, null, clock.instant()).toDomain();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public PurchaseRequest markAccepted(UUID requestId, UUID transactionId) {
        PurchaseRequestEntity entity = repository.findByIdForUpdate(requestId)
            .orElseThrow(() -> new ResourceNotFoundException("Purchase request", requestId));
        PurchaseRequest accepted = entity.toDomain().accept(transactionId, clock.instant());
        entity.updateFromDomain(accepted);
        repository.save(entity);
        ledgerMetrics.recordPurchaseRequest("accepted");
        return accepted;
    }

    /**
     * Persists EXPIRED on one request if it is past its expiry. Used by the maintenance sweep.
     *
     * @return whether the request was expired by this call
     */
    @Transactional
    public boolean expireIfDue(UUID requestId) {
        CorrelationContext.putEntity(CorrelationContext.REQUEST_ID_MDC_KEY, requestId);
        Instant now = clock.instant();
        PurchaseRequestEntity entity = repository.findByIdForUpdate(requestId).orElse(null);
        if (entity == null || !entity.toDomain().isExpired(now)) {
            return false;
        }
        persistExpiry(entity, now);
        return true;
    }

    @Transactional(readOnly = true)
    public List<UUID> findDueForExpiry() {
        return repository.findIdsWithStatusExpiredBy(PurchaseRequestStatus.PENDING, clock.instant());
    }

    @Transactional(readOnly = true)
    public PurchaseRequest getPurchaseRequest(UUID requestId) {
        return repository.findById(requestId)
            .map(entity -> entity.toDomain().asOf(clock.instant()))
            .orElseThrow(() -> new ResourceNotFoundException("Purchase request", requestId));
    }

    @Transactional(readOnly = true)
    public List<PurchaseRequest> requestsForCustomer(UUID customerId, PurchaseRequestStatus status) {
        return present(repository.findByCustomerIdOrderByCreatedAtDesc(customerId), status);
    }

    @Transactional(readOnly = true)
    public List<PurchaseRequest> requestsForMerchant(UUID merchantId, PurchaseRequestStatus status) {
        return present(repository.findByMerchantIdOrderByCreatedAtDesc(merchantId), status);
    }

    private List<PurchaseRequest> present(List<PurchaseRequestEntity> entities, PurchaseRequestStatus status) {
        Instant now = clock.instant();
        return entities.stream()
            .map(entity -> entity.toDomain().asOf(now))
            .filter(request -> status == null || request.getStatus() == status)
            .toList();
    }

    private PurchaseRequestEntity lockOpen(UUID requestId, UUID customerId, UUID merchantId, Instant now) {
        CorrelationContext.putEntity(CorrelationContext.REQUEST_ID_MDC_KEY, requestId);
        PurchaseRequestEntity entity = repository.findByIdForUpdate(requestId)
            .orElseThrow(() -> new ResourceNotFoundException("Purchase request", requestId));
        PurchaseRequest request = entity.toDomain();

        if (customerId != null && !customerId.equals(request.getCustomerId())) {
            throw new ForbiddenOperationException(
                "Customer " + customerId + " is not the recipient of purchase request " + requestId);
        }
        if (merchantId != null && !merchantId.equals(request.getMerchantId())) {
            throw new ForbiddenOperationException(
                "Merchant " + merchantId + " did not send purchase request " + requestId);
        }
        if (request.isTerminal()) {
            throw new InvalidStateException(String.format(
                "Purchase request %s is already %s", request.getReferenceNumber(), request.getStatus()));
        }
        if (request.isExpired(now)) {
            persistExpiry(entity, now);
            throw new RequestExpiredException(requestId, request.getExpiresAt());
        }
        return entity;
    }

    private void persistExpiry(PurchaseRequestEntity entity, Instant now) {
        PurchaseRequest expired = entity.toDomain().expire(now);
        entity.updateFromDomain(expired);
        repository.save(entity);
        outboxService.saveEvent(PurchaseRequestClosedEvent.from(expired, now));
        ledgerMetrics.recordPurchaseRequest("expired");
        log.info("Purchase request {} expired at {}", expired.getReferenceNumber(), expired.getExpiresAt());
    }
}
