package com.flagship.bnpl_ledger.payment;

import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.installment.ScheduleRow;
import com.flagship.bnpl_ledger.money.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Distributes a payment over a schedule, oldest installment first.
 *
 * Each unsettled row takes {@code min(left, row.amount - row.paidAmount)}; money left after a row
 * is full moves on to the next one, so a payment can pre-pay later installments. No I/O.
 */
@Component
public class PaymentApplicationEngine {

    public PaymentApplication apply(List<ScheduleRow> schedule, BigDecimal amount, UUID paymentId, Instant now) {
        BigDecimal left = Money.positive(amount, "Payment amount");
        List<ScheduleRow> ordered = new ArrayList<>(schedule);
        ordered.sort(Comparator.comparingInt(ScheduleRow::getInstallmentNumber));

        List<ScheduleRow> rows = new ArrayList<>(ordered.size());
        List<PaymentAllocation> allocations = new ArrayList<>();
        for (ScheduleRow row : ordered) {
            if (left.signum() == 0 || row.isSettled()) {
                rows.add(row);
                continue;
            }
            BigDecimal share = Money.min(left, row.remaining());
            rows.add(row.applyPayment(share, paymentId, now));
            allocations.add(new PaymentAllocation(UUID.randomUUID(), paymentId, row.getId(),
                row.getInstallmentNumber(), share));
            left = left.subtract(share);
        }

        if (left.signum() != 0) {
            throw new InvariantViolationException(String.format(
                "Payment %s left %s unallocated after the last installment", paymentId, left.toPlainString()));
        }
        return new PaymentApplication(List.copyOf(rows), List.copyOf(allocations));
    }
}
