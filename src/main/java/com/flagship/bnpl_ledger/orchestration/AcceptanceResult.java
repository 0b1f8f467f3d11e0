package com.flagship.bnpl_ledger.orchestration;

import com.flagship.bnpl_ledger.installment.PlanSchedule;
import com.flagship.bnpl_ledger.purchase.PurchaseRequest;
import com.flagship.bnpl_ledger.settlement.Settlement;
import com.flagship.bnpl_ledger.transaction.Transaction;
import lombok.Value;

/**
 * Everything an accepted purchase produced.
 */
@Value
public class AcceptanceResult {
    PurchaseRequest purchaseRequest;
    Transaction transaction;
    PlanSchedule schedule;
    Settlement incomeSettlement;
}
