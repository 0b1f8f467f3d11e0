package com.flagship.bnpl_ledger.consumer;

import com.flagship.bnpl_ledger.settlement.Settlement;
import com.flagship.bnpl_ledger.settlement.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Applies payout outcomes to withdrawals. Runs inside the de-duplication transaction of
 * {@link IdempotentEventProcessor}.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PayoutOutcomeHandler {

    private final SettlementService settlementService;

    public void onPayoutCompleted(PayoutOutcome outcome) {
        Settlement settlement = settlementService.completeSettlement(outcome.getSettlementId(), outcome.getBankReference());
        log.info("Withdrawal {} paid out, bank reference {}",
            settlement.getSettlementReference(), settlement.getBankReference());
    }

    public void onPayoutFailed(PayoutOutcome outcome) {
        String reason = outcome.getFailureReason() != null ? outcome.getFailureReason() : "Payout rejected by bank";
        Settlement settlement = settlementService.failSettlement(outcome.getSettlementId(), reason);
        log.info("Withdrawal {} failed, {} returned to merchant {}",
            settlement.getSettlementReference(), settlement.getNetAmount(), settlement.getMerchantId());
    }
}
