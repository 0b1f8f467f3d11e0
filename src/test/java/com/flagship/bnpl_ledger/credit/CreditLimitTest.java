package com.flagship.bnpl_ledger.credit;

import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.exception.LimitExceedsMaxException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Credit limit requests: auto-approval, admin review and stale approvals.
 */
class CreditLimitTest extends IntegrationTestSupport {

    @Autowired
    private CreditLedgerService creditLedgerService;

    @Test
    @DisplayName("Registration without a limit uses the default of 2000.00")
    void testDefaultLimit() {
        Customer customer = ledger.registerCustomer(null);

        assertEquals(money("2000.00"), customer.getCreditLimit());
        assertEquals(8, customer.getCustomerCode().length());
        assertThrows(LimitExceedsMaxException.class, () -> ledger.registerCustomer(money("50000.01")));
    }

    @Test
    @DisplayName("Increases up to 5000.00 apply immediately and keep outstanding untouched")
    void testAutoApproval() {
        printTestHeader("Auto-approved limit increase");
        Customer customer = customer("2000.00");
        Merchant merchant = merchant();
        accepted(merchant, customer, "1500.00", 3);

        CustomerLimitHistory history = ledger.requestLimitIncrease(customer.getId(), money("5000.00"), "Salary");
        printOutput("History", history);

        assertEquals(LimitRequestStatus.APPROVED, history.getStatus());
        assertEquals(CustomerLimitHistory.AUTO_APPROVER, history.getDecidedBy());
        Customer raised = creditLedgerService.getCustomer(customer.getId());
        assertEquals(money("5000.00"), raised.getCreditLimit());
        assertEquals(money("3500.00"), raised.getAvailableBalance());
        assertEquals(money("1500.00"), raised.getOutstandingBalance());
        printSuccess("Limit raised to 5000.00");
    }

    @Test
    @DisplayName("Increases above 5000.00 wait for an administrator")
    void testPendingThenApproved() {
        printTestHeader("Admin-approved limit increase");
        Customer customer = customer("2000.00");

        CustomerLimitHistory pending = ledger.requestLimitIncrease(customer.getId(), money("12000.00"), "Business");
        assertEquals(LimitRequestStatus.PENDING, pending.getStatus());
        assertEquals(money("2000.00"), creditLedgerService.getCustomer(customer.getId()).getCreditLimit());
        assertEquals(1, creditLedgerService.pendingLimitRequests().size());

        assertThrows(InvalidStateException.class,
            () -> ledger.requestLimitIncrease(customer.getId(), money("9000.00"), "Again"));

        CustomerLimitHistory approved = ledger.approveLimitIncrease(pending.getId(), "admin@bnpl", "Verified income");
        printOutput("Approved", approved);

        assertEquals(LimitRequestStatus.APPROVED, approved.getStatus());
        assertEquals(money("12000.00"), approved.getNewLimit());
        assertEquals("admin@bnpl", approved.getDecidedBy());
        Customer raised = creditLedgerService.getCustomer(customer.getId());
        assertEquals(money("12000.00"), raised.getCreditLimit());
        assertEquals(money("12000.00"), raised.getAvailableBalance());
        assertTrue(creditLedgerService.pendingLimitRequests().isEmpty());

        assertThrows(InvalidStateException.class,
            () -> ledger.approveLimitIncrease(pending.getId(), "admin@bnpl", null));
        printSuccess("Limit raised after review");
    }

    @Test
    void testRejectedRequestLeavesLimit() {
        Customer customer = customer("2000.00");
        CustomerLimitHistory pending = ledger.requestLimitIncrease(customer.getId(), money("20000.00"), null);

        CustomerLimitHistory rejected = ledger.rejectLimitIncrease(pending.getId(), "risk-team", "Too high");

        assertEquals(LimitRequestStatus.REJECTED, rejected.getStatus());
        assertEquals(money("2000.00"), rejected.getNewLimit());
        assertEquals(money("2000.00"), creditLedgerService.getCustomer(customer.getId()).getCreditLimit());

        List<CustomerLimitHistory> history = creditLedgerService.limitHistory(customer.getId());
        assertEquals(1, history.size());
        assertEquals(LimitRequestStatus.REJECTED, history.get(0).getStatus());
    }

    @Test
    @DisplayName("Approving a request the limit has already overtaken rejects it instead")
    void testStaleApproval() {
        printTestHeader("Stale limit request");
        Customer customer = customer("2000.00");
        CustomerLimitHistory pending = ledger.requestLimitIncrease(customer.getId(), money("8000.00"), null);
        jdbcTemplate.update("UPDATE customers SET credit_limit = 9000.00, available_balance = 9000.00 WHERE id = ?",
            customer.getId());

        assertThrows(InvalidStateException.class,
            () -> ledger.approveLimitIncrease(pending.getId(), "admin@bnpl", null));

        CustomerLimitHistory stored = creditLedgerService.limitHistory(customer.getId()).get(0);
        printOutput("Stored", stored);
        assertEquals(LimitRequestStatus.REJECTED, stored.getStatus());
        assertEquals(money("9000.00"), creditLedgerService.getCustomer(customer.getId()).getCreditLimit());
        printSuccess("Stale request closed as REJECTED");
    }

    @Test
    void testLimitRequestValidation() {
        Customer customer = customer("3000.00");

        assertThrows(LedgerValidationException.class,
            () -> ledger.requestLimitIncrease(customer.getId(), money("3000.00"), null));
        assertThrows(LedgerValidationException.class,
            () -> ledger.requestLimitIncrease(customer.getId(), money("-1.00"), null));
        assertThrows(LimitExceedsMaxException.class,
            () -> ledger.requestLimitIncrease(customer.getId(), money("60000.00"), null));
        assertThrows(ResourceNotFoundException.class,
            () -> ledger.requestLimitIncrease(unknownId(), money("4000.00"), null));
    }

    @Test
    @DisplayName("Blocked customers cannot receive new purchase requests")
    void testBlockedCustomer() {
        Customer customer = customer("3000.00");
        Merchant merchant = merchant();
        ledger.changeCustomerStatus(customer.getId(), CustomerStatus.BLOCKED);

        assertThrows(InvalidStateException.class, () -> purchase(merchant, customer, 1, "10.00"));
    }
}
