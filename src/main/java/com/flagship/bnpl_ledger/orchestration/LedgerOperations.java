package com.flagship.bnpl_ledger.orchestration;

import com.flagship.bnpl_ledger.credit.CreditLedgerService;
import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.credit.CustomerLimitHistory;
import com.flagship.bnpl_ledger.credit.CustomerStatus;
import com.flagship.bnpl_ledger.exception.BusinessRuleException;
import com.flagship.bnpl_ledger.exception.ConcurrencyConflictException;
import com.flagship.bnpl_ledger.exception.ForbiddenOperationException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.observability.LedgerMetrics;
import com.flagship.bnpl_ledger.payment.PaymentMethod;
import com.flagship.bnpl_ledger.payment.PaymentResult;
import com.flagship.bnpl_ledger.payment.PaymentService;
import com.flagship.bnpl_ledger.purchase.PurchaseRequest;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestService;
import com.flagship.bnpl_ledger.settlement.BankDetails;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.settlement.MerchantService;
import com.flagship.bnpl_ledger.settlement.MerchantStatus;
import com.flagship.bnpl_ledger.settlement.Settlement;
import com.flagship.bnpl_ledger.settlement.SettlementService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for every state-changing ledger operation.
 *
 * Each call runs the underlying {@code @Transactional} service method inside the ledger
 * {@link RetryTemplate}: a lock timeout, deadlock or version conflict rolls the attempt back and
 * the whole operation is tried again from scratch. When the attempts are used up the caller gets
 * {@link ConcurrencyConflictException}. Business rule failures are never retried.
 *
 * This class must not be transactional itself, otherwise all attempts would share one transaction.
 */
@Service
@Slf4j
public class LedgerOperations {

    private final RetryTemplate retryTemplate;
    private final LedgerMetrics ledgerMetrics;
    private final CreditLedgerService creditLedgerService;
    private final MerchantService merchantService;
    private final PurchaseRequestService purchaseRequestService;
    private final PurchaseAcceptanceService acceptanceService;
    private final PaymentService paymentService;
    private final SettlementService settlementService;

    public LedgerOperations(@Qualifier("ledgerRetryTemplate") RetryTemplate retryTemplate,
                            LedgerMetrics ledgerMetrics,
                            CreditLedgerService creditLedgerService,
                            MerchantService merchantService,
                            PurchaseRequestService purchaseRequestService,
                            PurchaseAcceptanceService acceptanceService,
                            PaymentService paymentService,
                            SettlementService settlementService) {
        this.retryTemplate = retryTemplate;
        this.ledgerMetrics = ledgerMetrics;
        this.creditLedgerService = creditLedgerService;
        this.merchantService = merchantService;
        this.purchaseRequestService = purchaseRequestService;
        this.acceptanceService = acceptanceService;
        this.paymentService = paymentService;
        this.settlementService = settlementService;
    }

    public Customer registerCustomer(BigDecimal creditLimit) {
        return execute("register_customer", () -> creditLedgerService.registerCustomer(creditLimit));
    }

    public Merchant registerMerchant(String businessName, BankDetails bankDetails) {
        return execute("register_merchant", () -> merchantService.registerMerchant(businessName, bankDetails));
    }

    public PurchaseRequest sendPurchaseRequest(UUID merchantId, UUID customerId, String productName,
                                               String productDescription, int quantity, BigDecimal unitPrice) {
        return execute("send_purchase_request", () -> purchaseRequestService.sendPurchaseRequest(
            merchantId, customerId, productName, productDescription, quantity, unitPrice));
    }

    public AcceptanceResult acceptPurchase(UUID requestId, UUID customerId, int planType) {
        return execute("accept_purchase", () -> acceptanceService.acceptPurchase(requestId, customerId, planType));
    }

    public PurchaseRequest rejectPurchase(UUID requestId, UUID customerId, String reason) {
        return execute("reject_purchase", () -> purchaseRequestService.rejectPurchase(requestId, customerId, reason));
    }

    public PurchaseRequest cancelPurchase(UUID requestId, UUID merchantId) {
        return execute("cancel_purchase", () -> purchaseRequestService.cancelPurchase(requestId, merchantId));
    }

    public PaymentResult makePayment(UUID transactionId, UUID customerId, BigDecimal amount,
                                     PaymentMethod method, String idempotencyKey) {
        return execute("make_payment", () -> paymentService.makePayment(
            transactionId, customerId, amount, method, idempotencyKey));
    }

    public Settlement requestWithdrawal(UUID merchantId, BigDecimal amount, BankDetails bankDetails) {
        return execute("request_withdrawal", () -> settlementService.requestWithdrawal(merchantId, amount, bankDetails));
    }

    public Settlement markSettlementProcessing(UUID settlementId) {
        return execute("process_settlement", () -> settlementService.markProcessing(settlementId));
    }

    public Settlement completeSettlement(UUID settlementId, String bankReference) {
        return execute("complete_settlement", () -> settlementService.completeSettlement(settlementId, bankReference));
    }

    public Settlement failSettlement(UUID settlementId, String reason) {
        return execute("fail_settlement", () -> settlementService.failSettlement(settlementId, reason));
    }

    public CustomerLimitHistory requestLimitIncrease(UUID customerId, BigDecimal newLimit, String reason) {
        return execute("request_limit_increase",
            () -> creditLedgerService.requestLimitIncrease(customerId, newLimit, reason));
    }

    public CustomerLimitHistory approveLimitIncrease(UUID historyId, String approver, String note) {
        return execute("approve_limit_increase",
            () -> creditLedgerService.approveLimitIncrease(historyId, approver, note));
    }

    public CustomerLimitHistory rejectLimitIncrease(UUID historyId, String approver, String note) {
        return execute("reject_limit_increase",
            () -> creditLedgerService.rejectLimitIncrease(historyId, approver, note));
    }

    public Customer changeCustomerStatus(UUID customerId, CustomerStatus status) {
        return execute("change_customer_status", () -> creditLedgerService.changeStatus(customerId, status));
    }

    public Merchant changeMerchantStatus(UUID merchantId, MerchantStatus status) {
        return execute("change_merchant_status", () -> merchantService.changeStatus(merchantId, status));
    }

    <T> T execute(String operation, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        String outcome = "error";
        try {
            T result = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    ledgerMetrics.recordConcurrencyRetry(operation);
                    log.warn("Retrying {} (attempt {}) after conflict: {}", operation,
                        context.getRetryCount() + 1, context.getLastThrowable().getMessage());
                }
                return action.get();
            });
            outcome = "success";
            return result;
        } catch (ConcurrencyFailureException e) {
            outcome = "busy";
            log.warn("Giving up on {} after repeated conflicts: {}", operation, e.getMessage());
            throw new ConcurrencyConflictException(operation, e);
        } catch (BusinessRuleException | IllegalArgumentException | ResourceNotFoundException
                 | ForbiddenOperationException e) {
            outcome = "rejected";
            throw e;
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordLatency(operation, outcome, duration);
            log.debug("{} finished: outcome={}, duration={}ms", operation, outcome, duration);
        }
    }
}
