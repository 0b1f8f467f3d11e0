package com.flagship.bnpl_ledger.installment;

import com.flagship.bnpl_ledger.config.LedgerProperties;
import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a total into an interest-free installment schedule.
 *
 * Every row but the last gets {@code floor(total / n)} at two decimals; the last row takes the
 * remainder, so the rows always add up to the total exactly. Row {@code i} (zero based) is due
 * {@code i} calendar months after the first due date; month ends are clamped by
 * {@link LocalDate#plusMonths(long)}.
 */
@Component
@RequiredArgsConstructor
public class InstallmentPlanGenerator {

    private final LedgerProperties properties;

    public List<ScheduledInstallment> generate(BigDecimal totalAmount, PlanType planType, LocalDate firstDueDate) {
        BigDecimal total = Money.positive(totalAmount, "Total amount");
        int count = planType.getInstallments();
        BigDecimal base = Money.floorDivide(total, count);
        if (base.signum() == 0) {
            throw new LedgerValidationException(String.format(
                "Total %s is too small to split into %d installments", total.toPlainString(), count));
        }

        List<ScheduledInstallment> rows = new ArrayList<>(count);
        for (int i = 0; i < count - 1; i++) {
            rows.add(new ScheduledInstallment(i + 1, base, firstDueDate.plusMonths(i)));
        }
        BigDecimal last = total.subtract(Money.multiply(base, count - 1));
        rows.add(new ScheduledInstallment(count, last, firstDueDate.plusMonths(count - 1)));

        verify(rows, total, count);
        return Collections.unmodifiableList(rows);
    }

    /**
     * Pay-in-full is due after the grace period; every other plan one month after acceptance.
     */
    public LocalDate firstDueDate(PlanType planType, LocalDate acceptedOn) {
        return planType.isPayInFull()
            ? acceptedOn.plusDays(properties.getPayInFullGraceDays())
            : acceptedOn.plusMonths(1);
    }

    /**
     * The amount every row but the last is charged.
     */
    public BigDecimal baseInstallment(BigDecimal totalAmount, PlanType planType) {
        return Money.floorDivide(Money.of(totalAmount), planType.getInstallments());
    }

    private void verify(List<ScheduledInstallment> rows, BigDecimal total, int count) {
        BigDecimal sum = rows.stream()
            .map(ScheduledInstallment::getAmount)
            .reduce(Money.ZERO, BigDecimal::add);
        if (rows.size() != count || sum.compareTo(total) != 0) {
            throw new InvariantViolationException(String.format(
                "Schedule of %d rows sums to %s, expected %d rows summing to %s",
                rows.size(), sum.toPlainString(), count, total.toPlainString()));
        }
        if (rows.get(count - 1).getAmount().signum() <= 0) {
            throw new InvariantViolationException("Last installment is not positive for total " + total.toPlainString());
        }
    }
}
