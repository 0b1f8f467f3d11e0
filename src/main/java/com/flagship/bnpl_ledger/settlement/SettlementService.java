package com.flagship.bnpl_ledger.settlement;

import com.flagship.bnpl_ledger.event.SettlementEvent;
import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
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
 * Merchant money movements.
 *
 * Income is booked once per transaction when the purchase is accepted. Withdrawals take the
 * amount off the balance as soon as they are requested; a failed payout puts it back.
 * The merchant row is always locked before the settlement row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final SettlementRepository settlementRepository;
    private final MerchantRepository merchantRepository;
    private final ReferenceGenerator referenceGenerator;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Records the COMPLETED income settlement of a newly created transaction and credits the
     * merchant with its net amount.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Settlement accrueIncome(UUID merchantId, UUID transactionId, CommissionBreakdown breakdown) {
        if (settlementRepository.existsByTransactionIdAndSettlementType(transactionId, SettlementType.INCOME)) {
            throw new InvariantViolationException("Income already recorded for transaction " + transactionId);
        }

        Instant now = clock.instant();
        MerchantEntity merchantEntity = lockMerchant(merchantId);
        Merchant merchant = merchantEntity.toDomain().accrueIncome(breakdown, now).verified();
        merchantEntity.updateFromDomain(merchant);
        merchantRepository.save(merchantEntity);

        Settlement income = Settlement.income(referenceGenerator.settlement(), merchantId, transactionId, breakdown, now);
        settlementRepository.save(SettlementEntity.fromDomain(income));
        outboxService.saveEvent(SettlementEvent.from(income, now));
        ledgerMetrics.recordSettlement(SettlementType.INCOME.name(), income.getStatus().name());

        log.info("Accrued income {} for merchant {}: net={}, commission={}, balance={}",
            income.getSettlementReference(), merchantId, breakdown.getNetAmount(),
            breakdown.getCommissionAmount(), merchant.getBalance());
        return income;
    }

    /**
     * Opens a PENDING withdrawal and takes the amount off the merchant balance. Without
     * {@code bankDetails} the payout goes to the account already on file.
     *
     * @throws com.flagship.bnpl_ledger.exception.InsufficientBalanceException if the balance is too low
     */
    @Transactional
    public Settlement requestWithdrawal(UUID merchantId, BigDecimal amount, BankDetails bankDetails) {
        BigDecimal value = Money.positive(amount, "Withdrawal amount");

        CorrelationContext.putEntity(CorrelationContext.MERCHANT_ID_MDC_KEY, merchantId);
        Instant now = clock.instant();
        MerchantEntity merchantEntity = lockMerchant(merchantId);
        Merchant current = merchantEntity.toDomain();
        if (!current.isActive()) {
            throw new InvalidStateException("Merchant " + merchantId + " is " + current.getStatus());
        }
        BankDetails payee = bankDetails != null ? bankDetails : current.getBankDetails();
        if (payee == null) {
            throw new LedgerValidationException("Bank details are required for a withdrawal");
        }

        Merchant debited = current.debit(value, now).withBankDetails(payee, now).verified();
        merchantEntity.updateFromDomain(debited);
        merchantRepository.save(merchantEntity);

        Settlement withdrawal = Settlement.withdrawal(referenceGenerator.settlement(), merchantId, value, payee, now);
        settlementRepository.save(SettlementEntity.fromDomain(withdrawal));
        outboxService.saveEvent(SettlementEvent.from(withdrawal, now));
        ledgerMetrics.recordSettlement(SettlementType.WITHDRAWAL.name(), withdrawal.getStatus().name());

        log.info("Withdrawal {} of {} requested, merchant balance now {}",
            withdrawal.getSettlementReference(), value, debited.getBalance());
        return withdrawal;
    }

    @Transactional
    public Settlement markProcessing(UUID settlementId) {
        CorrelationContext.putEntity(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId);
        Instant now = clock.instant();
        SettlementEntity entity = lockSettlement(settlementId);
        Settlement processing = entity.toDomain().markProcessing(now);
        entity.updateFromDomain(processing);
        settlementRepository.save(entity);
        outboxService.saveEvent(SettlementEvent.from(processing, now));
        ledgerMetrics.recordSettlement(processing.getSettlementType().name(), processing.getStatus().name());

        log.info("Settlement {} is processing", processing.getSettlementReference());
        return processing;
    }

    @Transactional
    public Settlement completeSettlement(UUID settlementId, String bankReference) {
        CorrelationContext.putEntity(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId);
        Instant now = clock.instant();
        SettlementEntity entity = lockSettlement(settlementId);
        Settlement completed = entity.toDomain().complete(bankReference, now);
        entity.updateFromDomain(completed);
        settlementRepository.save(entity);
        outboxService.saveEvent(SettlementEvent.from(completed, now));
        ledgerMetrics.recordSettlement(completed.getSettlementType().name(), completed.getStatus().name());

        log.info("Settlement {} completed, bank reference {}", completed.getSettlementReference(), bankReference);
        return completed;
    }

    /**
     * Fails a withdrawal and credits its amount back to the merchant.
     */
    @Transactional
    public Settlement failSettlement(UUID settlementId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new LedgerValidationException("Failure reason is required");
        }
        CorrelationContext.putEntity(CorrelationContext.SETTLEMENT_ID_MDC_KEY, settlementId);
        UUID merchantId = settlementRepository.findMerchantIdById(settlementId)
            .orElseThrow(() -> new ResourceNotFoundException("Settlement", settlementId));

        Instant now = clock.instant();
        MerchantEntity merchantEntity = lockMerchant(merchantId);
        SettlementEntity entity = lockSettlement(settlementId);
        Settlement failed = entity.toDomain().fail(reason, now);
        entity.updateFromDomain(failed);
        settlementRepository.save(entity);

        Merchant restored = merchantEntity.toDomain().credit(failed.getNetAmount(), now).verified();
        merchantEntity.updateFromDomain(restored);
        merchantRepository.save(merchantEntity);

        outboxService.saveEvent(SettlementEvent.from(failed, now));
        ledgerMetrics.recordSettlement(failed.getSettlementType().name(), failed.getStatus().name());

        log.warn("Settlement {} failed ({}), {} returned to merchant {} (balance {})",
            failed.getSettlementReference(), reason, failed.getNetAmount(), merchantId, restored.getBalance());
        return failed;
    }

    @Transactional(readOnly = true)
    public Settlement getSettlement(UUID settlementId) {
        return settlementRepository.findById(settlementId)
            .map(SettlementEntity::toDomain)
            .orElseThrow(() -> new ResourceNotFoundException("Settlement", settlementId));
    }

    @Transactional(readOnly = true)
    public List<Settlement> settlementsForMerchant(UUID merchantId, SettlementType type) {
        List<SettlementEntity> entities = type == null
            ? settlementRepository.findByMerchantIdOrderByCreatedAtDesc(merchantId)
            : settlementRepository.findByMerchantIdAndSettlementTypeOrderByCreatedAtDesc(merchantId, type);
        return entities.stream()
            .map(SettlementEntity::toDomain)
            .toList();
    }

    private MerchantEntity lockMerchant(UUID merchantId) {
        return merchantRepository.findByIdForUpdate(merchantId)
            .orElseThrow(() -> new ResourceNotFoundException("Merchant", merchantId));
    }

    private SettlementEntity lockSettlement(UUID settlementId) {
        return settlementRepository.findByIdForUpdate(settlementId)
            .orElseThrow(() -> new ResourceNotFoundException("Settlement", settlementId));
    }
}
