package com.flagship.bnpl_ledger.installment;

import com.flagship.bnpl_ledger.exception.LedgerValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Supported repayment plans, identified by their number of installments.
 */
public enum PlanType {
    PAY_IN_FULL(1),
    THREE_MONTHS(3),
    SIX_MONTHS(6),
    TWELVE_MONTHS(12),
    EIGHTEEN_MONTHS(18),
    TWENTY_FOUR_MONTHS(24);

    private final int installments;

    PlanType(int installments) {
        this.installments = installments;
    }

    public int getInstallments() {
        return installments;
    }

    public boolean isPayInFull() {
        return this == PAY_IN_FULL;
    }

    /**
     * @throws LedgerValidationException if no plan has that many installments
     */
    public static PlanType fromInstallments(int installments) {
        for (PlanType type : values()) {
            if (type.installments == installments) {
                return type;
            }
        }
        throw new LedgerValidationException("Unsupported plan type " + installments + ", expected one of "
            + Arrays.stream(values()).map(t -> String.valueOf(t.installments)).collect(Collectors.joining(", ")));
    }
}
