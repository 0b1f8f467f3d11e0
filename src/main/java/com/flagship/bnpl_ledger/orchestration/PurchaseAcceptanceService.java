package com.flagship.bnpl_ledger.orchestration;

import com.flagship.bnpl_ledger.config.LedgerProperties;
import com.flagship.bnpl_ledger.credit.CreditLedgerService;
import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.event.PurchaseAcceptedEvent;
import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.RequestExpiredException;
import com.flagship.bnpl_ledger.installment.InstallmentPlanGenerator;
import com.flagship.bnpl_ledger.installment.PlanSchedule;
import com.flagship.bnpl_ledger.installment.PlanType;
import com.flagship.bnpl_ledger.installment.RepaymentPlanService;
import com.flagship.bnpl_ledger.observability.CorrelationContext;
import com.flagship.bnpl_ledger.outbox.OutboxService;
import com.flagship.bnpl_ledger.purchase.PurchaseRequest;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestService;
import com.flagship.bnpl_ledger.reference.ReferenceGenerator;
import com.flagship.bnpl_ledger.settlement.CommissionBreakdown;
import com.flagship.bnpl_ledger.settlement.CommissionCalculator;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.settlement.MerchantService;
import com.flagship.bnpl_ledger.settlement.Settlement;
import com.flagship.bnpl_ledger.settlement.SettlementService;
import com.flagship.bnpl_ledger.transaction.Transaction;
import com.flagship.bnpl_ledger.transaction.TransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Turns a pending purchase request into a transaction.
 *
 * In one database transaction: lock the request, lock the customer and reserve the total,
 * open the transaction with its commission locked in, generate and store the schedule, book
 * the merchant's income and mark the request ACCEPTED. Nothing is visible unless all of it
 * commits. The only exception is an expired request, whose EXPIRED status is kept.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseAcceptanceService {

    private final PurchaseRequestService purchaseRequestService;
    private final CreditLedgerService creditLedgerService;
    private final MerchantService merchantService;
    private final TransactionService transactionService;
    private final RepaymentPlanService planService;
    private final InstallmentPlanGenerator planGenerator;
    private final CommissionCalculator commissionCalculator;
    private final SettlementService settlementService;
    private final ReferenceGenerator referenceGenerator;
    private final OutboxService outboxService;
    private final LedgerProperties properties;
    private final Clock clock;

    @Transactional(noRollbackFor = RequestExpiredException.class)
    public AcceptanceResult acceptPurchase(UUID requestId, UUID customerId, int installments) {
        PlanType planType = PlanType.fromInstallments(installments);

        PurchaseRequest request = purchaseRequestService.lockForCustomer(requestId, customerId);
        Customer customer = creditLedgerService.lockCustomer(customerId);
        if (!customer.isActive()) {
            throw new InvalidStateException("Customer " + customerId + " is " + customer.getStatus());
        }
        Merchant merchant = merchantService.getMerchant(request.getMerchantId());
        if (!merchant.isActive()) {
            throw new InvalidStateException("Merchant " + merchant.getId() + " is " + merchant.getStatus());
        }

        creditLedgerService.reserve(customerId, request.getTotalAmount());

        Instant now = clock.instant();
        LocalDate today = LocalDate.now(clock);
        LocalDate firstDueDate = planGenerator.firstDueDate(planType, today);
        LocalDate finalDueDate = firstDueDate.plusMonths(planType.getInstallments() - 1L);
        CommissionBreakdown commission = commissionCalculator.computeNet(request.getTotalAmount(),
            properties.getCommissionRate());

        Transaction transaction = transactionService.open(Transaction.open(UUID.randomUUID(),
            referenceGenerator.transaction(), request.getMerchantId(), customerId, requestId, commission,
            finalDueDate, now));
        PlanSchedule schedule = planService.createPlan(transaction.getId(), customerId, planType,
            request.getTotalAmount(), firstDueDate);
        Settlement income = settlementService.accrueIncome(request.getMerchantId(), transaction.getId(), commission);
        PurchaseRequest accepted = purchaseRequestService.markAccepted(requestId, transaction.getId());

        outboxService.saveEvent(PurchaseAcceptedEvent.from(transaction, schedule.getPlan(), firstDueDate));

        CorrelationContext.putEntity(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId());
        log.info("Accepted purchase {} as {} on a {}-installment plan, first due {}",
            accepted.getReferenceNumber(), transaction.getTransactionNumber(), planType.getInstallments(),
            firstDueDate);
        return new AcceptanceResult(accepted, transaction, schedule, income);
    }
}
