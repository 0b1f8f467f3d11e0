package com.flagship.bnpl_ledger.settlement;

import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.money.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Computes the platform commission on a gross amount.
 *
 * {@code commission = round(gross * rate, 2, HALF_UP)} and {@code net = gross - commission}, so the
 * two parts always add back up to the gross amount.
 */
@Component
public class CommissionCalculator {

    public CommissionBreakdown computeNet(BigDecimal grossAmount, BigDecimal rate) {
        BigDecimal gross = Money.of(grossAmount);
        if (gross.signum() < 0) {
            throw new LedgerValidationException("Gross amount cannot be negative: " + gross.toPlainString());
        }
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new LedgerValidationException("Commission rate must be between 0 and 1, got " + rate);
        }

        BigDecimal commission = Money.roundHalfUp(gross.multiply(rate));
        BigDecimal net = gross.subtract(commission);

        if (net.add(commission).compareTo(gross) != 0 || net.signum() < 0) {
            throw new InvariantViolationException(String.format(
                "Commission split of %s at rate %s is inconsistent: net %s, commission %s",
                gross.toPlainString(), rate.toPlainString(), net.toPlainString(), commission.toPlainString()));
        }
        return new CommissionBreakdown(gross, rate, commission, net);
    }
}
