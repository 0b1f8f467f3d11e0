package com.flagship.bnpl_ledger.installment;

import lombok.Value;

import java.util.List;

/**
 * A repayment plan together with its rows in installment order.
 */
@Value
public class PlanSchedule {
    RepaymentPlan plan;
    List<ScheduleRow> rows;
}
