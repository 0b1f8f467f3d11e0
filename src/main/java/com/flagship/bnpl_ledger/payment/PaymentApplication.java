package com.flagship.bnpl_ledger.payment;

import com.flagship.bnpl_ledger.installment.ScheduleRow;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of distributing one payment over a schedule.
 */
@Value
public class PaymentApplication {
    /** Every row of the schedule after the payment, in installment order. */
    List<ScheduleRow> rows;
    List<PaymentAllocation> allocations;

    public int installmentsCovered() {
        return allocations.size();
    }

    public boolean hasOverdueRows(LocalDate today) {
        return rows.stream().anyMatch(row -> row.isOverdue(today));
    }
}
