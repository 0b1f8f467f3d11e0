package com.flagship.bnpl_ledger.payment;

import com.flagship.bnpl_ledger.exception.InvalidAmountException;
import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.installment.InstallmentStatus;
import com.flagship.bnpl_ledger.installment.ScheduleRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentApplicationEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final PaymentApplicationEngine engine = new PaymentApplicationEngine();
    private final UUID planId = UUID.randomUUID();

    private List<ScheduleRow> schedule(String... amounts) {
        List<ScheduleRow> rows = new ArrayList<>();
        LocalDate due = LocalDate.of(2026, 2, 1);
        for (int i = 0; i < amounts.length; i++) {
            rows.add(new ScheduleRow(UUID.randomUUID(), planId, i + 1, new BigDecimal(amounts[i]),
                due.plusMonths(i), InstallmentStatus.PENDING, new BigDecimal("0.00"), null, null));
        }
        return rows;
    }

    @Test
    @DisplayName("An exact installment payment settles only the first row")
    void testExactInstallment() {
        List<ScheduleRow> rows = schedule("333.33", "333.33", "333.34");
        UUID paymentId = UUID.randomUUID();

        PaymentApplication result = engine.apply(rows, new BigDecimal("333.33"), paymentId, NOW);

        assertEquals(1, result.installmentsCovered());
        assertEquals(InstallmentStatus.PAID, result.getRows().get(0).getStatus());
        assertEquals(NOW, result.getRows().get(0).getPaidAt());
        assertEquals(paymentId, result.getRows().get(0).getLastPaymentId());
        assertEquals(InstallmentStatus.PENDING, result.getRows().get(1).getStatus());
        assertEquals(new BigDecimal("333.33"), result.getAllocations().get(0).getAmount());
    }

    @Test
    @DisplayName("A payment larger than one installment spills over to the next rows")
    void testPrepaymentSpillsOver() {
        List<ScheduleRow> rows = schedule("1333.00", "1333.00", "1333.00");

        PaymentApplication result = engine.apply(rows, new BigDecimal("2000.00"), UUID.randomUUID(), NOW);

        assertEquals(2, result.installmentsCovered());
        assertEquals(InstallmentStatus.PAID, result.getRows().get(0).getStatus());
        ScheduleRow second = result.getRows().get(1);
        assertEquals(InstallmentStatus.PENDING, second.getStatus());
        assertEquals(new BigDecimal("667.00"), second.getPaidAmount());
        assertNull(second.getPaidAt());
        assertEquals(new BigDecimal("667.00"), result.getAllocations().get(1).getAmount());
        assertEquals(2, result.getAllocations().get(1).getInstallmentNumber());
    }

    @Test
    @DisplayName("A partial payment then tops up the same row first")
    void testPartiallyPaidRowIsFilledFirst() {
        List<ScheduleRow> rows = schedule("100.00", "100.00");
        PaymentApplication first = engine.apply(rows, new BigDecimal("40.00"), UUID.randomUUID(), NOW);

        PaymentApplication second = engine.apply(first.getRows(), new BigDecimal("80.00"), UUID.randomUUID(), NOW);

        assertEquals(new BigDecimal("100.00"), second.getRows().get(0).getPaidAmount());
        assertEquals(InstallmentStatus.PAID, second.getRows().get(0).getStatus());
        assertEquals(new BigDecimal("20.00"), second.getRows().get(1).getPaidAmount());
        assertEquals(new BigDecimal("60.00"), second.getAllocations().get(0).getAmount());
        assertEquals(new BigDecimal("20.00"), second.getAllocations().get(1).getAmount());
    }

    @Test
    @DisplayName("Rows are applied in installment order regardless of input order")
    void testOldestFirst() {
        List<ScheduleRow> rows = new ArrayList<>(schedule("50.00", "50.00", "50.00"));
        java.util.Collections.reverse(rows);

        PaymentApplication result = engine.apply(rows, new BigDecimal("50.00"), UUID.randomUUID(), NOW);

        assertEquals(1, result.getAllocations().get(0).getInstallmentNumber());
        assertEquals(1, result.getRows().get(0).getInstallmentNumber());
    }

    @Test
    @DisplayName("Paying the whole remainder settles every row")
    void testFullPayoff() {
        List<ScheduleRow> rows = schedule("333.33", "333.33", "333.34");

        PaymentApplication result = engine.apply(rows, new BigDecimal("1000.00"), UUID.randomUUID(), NOW);

        assertEquals(3, result.installmentsCovered());
        assertTrue(result.getRows().stream().allMatch(ScheduleRow::isSettled));
        assertFalse(result.hasOverdueRows(LocalDate.of(2030, 1, 1)));
    }

    @Test
    @DisplayName("Overdue detection looks at unsettled rows past their due date")
    void testOverdueDetection() {
        List<ScheduleRow> rows = schedule("100.00", "100.00");

        PaymentApplication result = engine.apply(rows, new BigDecimal("100.00"), UUID.randomUUID(), NOW);

        assertFalse(result.hasOverdueRows(LocalDate.of(2026, 3, 1)));
        assertTrue(result.hasOverdueRows(LocalDate.of(2026, 3, 2)));
    }

    @Test
    @DisplayName("Money left after the last row is an invariant violation")
    void testOverpaymentIsRefused() {
        List<ScheduleRow> rows = schedule("100.00", "100.00");

        assertThrows(InvariantViolationException.class,
            () -> engine.apply(rows, new BigDecimal("200.01"), UUID.randomUUID(), NOW));
        assertThrows(InvalidAmountException.class,
            () -> engine.apply(rows, new BigDecimal("0.00"), UUID.randomUUID(), NOW));
    }
}
