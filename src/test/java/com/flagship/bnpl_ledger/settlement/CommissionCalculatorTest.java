package com.flagship.bnpl_ledger.settlement;

import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class CommissionCalculatorTest {

    private static final BigDecimal RATE = new BigDecimal("0.005");

    private final CommissionCalculator calculator = new CommissionCalculator();

    @ParameterizedTest(name = "{0} at 0.5% -> commission {1}, net {2}")
    @CsvSource({
        "3999.00, 20.00, 3979.00",
        "1000.00, 5.00, 995.00",
        "1.00, 0.01, 0.99",
        "0.99, 0.00, 0.99",
        "0.00, 0.00, 0.00",
        "250.50, 1.25, 249.25"
    })
    @DisplayName("Commission rounds half up and net takes the rest")
    void testBreakdown(String gross, String commission, String net) {
        CommissionBreakdown breakdown = calculator.computeNet(new BigDecimal(gross), RATE);

        assertEquals(new BigDecimal(commission), breakdown.getCommissionAmount());
        assertEquals(new BigDecimal(net), breakdown.getNetAmount());
        assertEquals(0, breakdown.getNetAmount().add(breakdown.getCommissionAmount())
            .compareTo(breakdown.getGrossAmount()));
    }

    @Test
    @DisplayName("Rates outside [0, 1] and negative gross are rejected")
    void testInvalidInputs() {
        assertThrows(LedgerValidationException.class,
            () -> calculator.computeNet(new BigDecimal("100.00"), new BigDecimal("-0.01")));
        assertThrows(LedgerValidationException.class,
            () -> calculator.computeNet(new BigDecimal("100.00"), new BigDecimal("1.01")));
        assertThrows(LedgerValidationException.class,
            () -> calculator.computeNet(new BigDecimal("100.00"), null));
        assertThrows(LedgerValidationException.class,
            () -> calculator.computeNet(new BigDecimal("-1.00"), RATE));
    }

    @Test
    void testFullRateLeavesNothingForMerchant() {
        CommissionBreakdown breakdown = calculator.computeNet(new BigDecimal("80.00"), BigDecimal.ONE);
        assertEquals(new BigDecimal("80.00"), breakdown.getCommissionAmount());
        assertEquals(new BigDecimal("0.00"), breakdown.getNetAmount());
    }
}
