package com.flagship.bnpl_ledger.money;

import com.flagship.bnpl_ledger.exception.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point currency arithmetic.
 *
 * All money in the ledger is a {@link BigDecimal} with scale 2. Values entering the system
 * are normalized with {@link #of(BigDecimal)}, which refuses anything that would need rounding;
 * the only places that round are {@link #roundHalfUp(BigDecimal)} (commission) and
 * {@link #floorDivide(BigDecimal, int)} (installment base amount).
 */
public final class Money {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Money() {
        // Utility class
    }

    /**
     * Normalizes an amount to scale 2.
     *
     * @throws InvalidAmountException if the amount is null or has more than two decimals
     */
    public static BigDecimal of(BigDecimal amount) {
        if (amount == null) {
            throw new InvalidAmountException("Amount is required");
        }
        if (amount.stripTrailingZeros().scale() > SCALE) {
            throw new InvalidAmountException("Amount " + amount.toPlainString() + " has more than " + SCALE + " decimals");
        }
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public static BigDecimal of(String amount) {
        try {
            return of(new BigDecimal(amount));
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Not a decimal amount: " + amount);
        }
    }

    /**
     * Normalizes an amount and requires it to be strictly positive.
     */
    public static BigDecimal positive(BigDecimal amount, String field) {
        BigDecimal normalized = of(amount);
        if (normalized.signum() <= 0) {
            throw new InvalidAmountException(field + " must be greater than 0, got " + normalized.toPlainString());
        }
        return normalized;
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount.signum() > 0;
    }

    public static boolean isZero(BigDecimal amount) {
        return amount.signum() == 0;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    /**
     * Rounds to scale 2, half away from zero.
     */
    public static BigDecimal roundHalfUp(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code floor(total / parts)} at scale 2. Never exceeds the exact quotient, so
     * {@code parts * result <= total} always holds.
     */
    public static BigDecimal floorDivide(BigDecimal total, int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("parts must be positive: " + parts);
        }
        return total.divide(BigDecimal.valueOf(parts), SCALE, RoundingMode.FLOOR);
    }

    public static BigDecimal multiply(BigDecimal amount, int factor) {
        return amount.multiply(BigDecimal.valueOf(factor)).setScale(SCALE, RoundingMode.UNNECESSARY);
    }
}
