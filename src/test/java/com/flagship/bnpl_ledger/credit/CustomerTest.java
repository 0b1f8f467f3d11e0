package com.flagship.bnpl_ledger.credit;

import com.flagship.bnpl_ledger.exception.InsufficientCreditException;
import com.flagship.bnpl_ledger.exception.InvariantViolationException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reservation model: available + outstanding always equals the limit.
 */
class CustomerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private static void assertConserved(Customer customer) {
        assertEquals(0, customer.getAvailableBalance().add(customer.getOutstandingBalance())
            .compareTo(customer.getCreditLimit()));
    }

    private Customer fresh(String limit) {
        return Customer.register(UUID.randomUUID(), "AB12CD34", new BigDecimal(limit), NOW);
    }

    @Test
    @DisplayName("A new customer has the whole limit available")
    void testRegister() {
        Customer customer = fresh("5000");

        assertEquals(new BigDecimal("5000.00"), customer.getCreditLimit());
        assertEquals(new BigDecimal("5000.00"), customer.getAvailableBalance());
        assertEquals(new BigDecimal("0.00"), customer.getOutstandingBalance());
        assertEquals(CustomerStatus.ACTIVE, customer.getStatus());
        assertThrows(LedgerValidationException.class,
            () -> Customer.register(UUID.randomUUID(), "X", new BigDecimal("-1.00"), NOW));
    }

    @Test
    @DisplayName("Reserve then release restores the original position")
    void testReserveRelease() {
        Customer reserved = fresh("5000.00").reserve(new BigDecimal("3999.00"), NOW);
        assertEquals(new BigDecimal("1001.00"), reserved.getAvailableBalance());
        assertEquals(new BigDecimal("3999.00"), reserved.getOutstandingBalance());
        assertConserved(reserved);

        Customer released = reserved.release(new BigDecimal("1333.00"), NOW);
        assertEquals(new BigDecimal("2334.00"), released.getAvailableBalance());
        assertEquals(new BigDecimal("2666.00"), released.getOutstandingBalance());
        assertConserved(released);
    }

    @Test
    @DisplayName("Reserving more than is available fails with INSUFFICIENT_CREDIT")
    void testInsufficientCredit() {
        Customer customer = fresh("500.00");

        InsufficientCreditException e = assertThrows(InsufficientCreditException.class,
            () -> customer.reserve(new BigDecimal("1000.00"), NOW));
        assertEquals("INSUFFICIENT_CREDIT", e.getErrorCode());
        assertEquals(new BigDecimal("500.00"), customer.reserve(new BigDecimal("500.00"), NOW).getOutstandingBalance());
    }

    @Test
    void testReleaseBeyondOutstandingIsAnInvariantViolation() {
        Customer reserved = fresh("1000.00").reserve(new BigDecimal("100.00"), NOW);
        assertThrows(InvariantViolationException.class, () -> reserved.release(new BigDecimal("100.01"), NOW));
    }

    @Test
    @DisplayName("Raising the limit adds the whole delta to available")
    void testRaiseLimit() {
        Customer raised = fresh("5000.00")
            .reserve(new BigDecimal("3000.00"), NOW)
            .raiseLimit(new BigDecimal("8000.00"), NOW);

        assertEquals(new BigDecimal("8000.00"), raised.getCreditLimit());
        assertEquals(new BigDecimal("5000.00"), raised.getAvailableBalance());
        assertEquals(new BigDecimal("3000.00"), raised.getOutstandingBalance());
        assertThrows(LedgerValidationException.class, () -> raised.raiseLimit(new BigDecimal("8000.00"), NOW));
    }

    @Test
    void testStatusChangeKeepsBalances() {
        Customer suspended = fresh("100.00").withStatus(CustomerStatus.SUSPENDED, NOW.plusSeconds(5));
        assertFalse(suspended.isActive());
        assertEquals(new BigDecimal("100.00"), suspended.getAvailableBalance());
        assertEquals(NOW.plusSeconds(5), suspended.getUpdatedAt());
    }
}
