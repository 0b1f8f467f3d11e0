package com.flagship.bnpl_ledger.maintenance;

import com.flagship.bnpl_ledger.observability.CorrelationContext;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestService;
import com.flagship.bnpl_ledger.transaction.TransactionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Persists the time-derived states that reads already present lazily: EXPIRED purchase
 * requests and OVERDUE installments.
 *
 * Each item is handled in its own transaction. An item that fails is logged and picked up
 * again on the next run. A sweep logs under its own correlation id and entity MDC keys are
 * dropped after every item.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "ledger.sweeper.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class LedgerSweeper {

    private final PurchaseRequestService purchaseRequestService;
    private final TransactionService transactionService;

    @Scheduled(cron = "${ledger.sweeper.cron:0 */15 * * * *}")
    public void sweep() {
        CorrelationContext.begin(null);
        try {
            int expired = expirePurchaseRequests();
            int overdue = flagOverdueTransactions();
            if (expired > 0 || overdue > 0) {
                log.info("Sweep finished: {} purchase requests expired, {} transactions flagged overdue", expired, overdue);
            }
        } finally {
            CorrelationContext.end();
        }
    }

    int expirePurchaseRequests() {
        List<UUID> due = purchaseRequestService.findDueForExpiry();
        int expired = 0;
        for (UUID requestId : due) {
            try {
                if (purchaseRequestService.expireIfDue(requestId)) {
                    expired++;
                }
            } catch (DataAccessException e) {
                log.warn("Could not expire purchase request {}, will retry next sweep: {}", requestId, e.getMessage());
            } finally {
                CorrelationContext.clearEntities();
            }
        }
        return expired;
    }

    int flagOverdueTransactions() {
        List<UUID> pastDue = transactionService.findWithInstallmentsPastDue();
        int flagged = 0;
        for (UUID transactionId : pastDue) {
            try {
                if (transactionService.flagOverdue(transactionId)) {
                    flagged++;
                }
            } catch (DataAccessException e) {
                log.warn("Could not flag transaction {} overdue, will retry next sweep: {}", transactionId, e.getMessage());
            } finally {
                CorrelationContext.clearEntities();
            }
        }
        return flagged;
    }
}
