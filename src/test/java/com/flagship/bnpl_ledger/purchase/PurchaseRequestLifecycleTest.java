package com.flagship.bnpl_ledger.purchase;

import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.credit.CustomerStatus;
import com.flagship.bnpl_ledger.exception.ForbiddenOperationException;
import com.flagship.bnpl_ledger.exception.InsufficientCreditException;
import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.exception.RequestExpiredException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PurchaseRequestLifecycleTest extends IntegrationTestSupport {

    @Autowired
    private PurchaseRequestService purchaseRequestService;

    @Test
    @DisplayName("Customer rejects a pending request; credit is untouched")
    void testReject() {
        printTestHeader("Reject purchase request");
        Customer customer = customer("2000.00");
        PurchaseRequest request = purchase(merchant(), customer, 2, "150.00");

        PurchaseRequest rejected = ledger.rejectPurchase(request.getId(), customer.getId(), "Changed my mind");
        printOutput("Rejected", rejected);

        assertEquals(PurchaseRequestStatus.REJECTED, rejected.getStatus());
        assertEquals("Changed my mind", rejected.getRejectionReason());
        assertEquals(0, money("2000.00").compareTo(jdbcTemplate.queryForObject(
            "SELECT available_balance FROM customers WHERE id = ?", BigDecimal.class, customer.getId())));
        assertThrows(InvalidStateException.class, () -> ledger.acceptPurchase(request.getId(), customer.getId(), 3));
        printSuccess("Rejected request is terminal");
    }

    @Test
    @DisplayName("Merchant cancels its own request; another merchant may not")
    void testCancel() {
        Customer customer = customer("2000.00");
        Merchant merchant = merchant();
        Merchant otherMerchant = merchant();
        PurchaseRequest request = purchase(merchant, customer, 1, "300.00");

        assertThrows(ForbiddenOperationException.class,
            () -> ledger.cancelPurchase(request.getId(), otherMerchant.getId()));

        PurchaseRequest cancelled = ledger.cancelPurchase(request.getId(), merchant.getId());
        assertEquals(PurchaseRequestStatus.CANCELLED, cancelled.getStatus());
        assertNotNull(cancelled.getCancelledAt());

        assertThrows(InvalidStateException.class, () -> ledger.cancelPurchase(request.getId(), merchant.getId()));
        assertThrows(InvalidStateException.class,
            () -> ledger.rejectPurchase(request.getId(), customer.getId(), null));
    }

    @Test
    @DisplayName("Rejecting or cancelling after expiry persists EXPIRED and reports it")
    void testCloseAfterExpiry() {
        Customer customer = customer("2000.00");
        Merchant merchant = merchant();
        PurchaseRequest first = purchase(merchant, customer, 1, "100.00");
        PurchaseRequest second = purchase(merchant, customer, 1, "100.00");
        clock.advance(Duration.ofHours(24));

        assertThrows(RequestExpiredException.class,
            () -> ledger.rejectPurchase(first.getId(), customer.getId(), null));
        assertThrows(RequestExpiredException.class,
            () -> ledger.cancelPurchase(second.getId(), merchant.getId()));

        List<String> statuses = jdbcTemplate.queryForList(
            "SELECT status FROM purchase_requests WHERE merchant_id = ?", String.class, merchant.getId());
        assertEquals(List.of("EXPIRED", "EXPIRED"), statuses);
    }

    @Test
    @DisplayName("Merchant view presents overdue pending requests as EXPIRED and filters by status")
    void testMerchantView() {
        Customer customer = customer("2000.00");
        Merchant merchant = merchant();
        purchase(merchant, customer, 1, "100.00");
        clock.advance(Duration.ofHours(23));
        PurchaseRequest fresh = purchase(merchant, customer, 1, "200.00");
        clock.advance(Duration.ofHours(2));

        assertEquals(1, purchaseRequestService.requestsForMerchant(merchant.getId(), PurchaseRequestStatus.EXPIRED).size());
        List<PurchaseRequest> pending =
            purchaseRequestService.requestsForMerchant(merchant.getId(), PurchaseRequestStatus.PENDING);
        assertEquals(List.of(fresh.getId()), pending.stream().map(PurchaseRequest::getId).toList());
        assertEquals(2, purchaseRequestService.requestsForCustomer(customer.getId(), null).size());
    }

    @Test
    @DisplayName("Sending is refused for unknown parties, inactive customers, bad input and insufficient credit")
    void testSendValidation() {
        Customer customer = customer("500.00");
        Merchant merchant = merchant();

        assertThrows(ResourceNotFoundException.class, () -> ledger.sendPurchaseRequest(
            unknownId(), customer.getId(), "Lamp", null, 1, money("10.00")));
        assertThrows(LedgerValidationException.class, () -> ledger.sendPurchaseRequest(
            merchant.getId(), customer.getId(), " ", null, 1, money("10.00")));
        assertThrows(LedgerValidationException.class, () -> ledger.sendPurchaseRequest(
            merchant.getId(), customer.getId(), "Lamp", null, 0, money("10.00")));
        assertThrows(InsufficientCreditException.class, () -> ledger.sendPurchaseRequest(
            merchant.getId(), customer.getId(), "Sofa", null, 1, money("500.01")));

        ledger.changeCustomerStatus(customer.getId(), CustomerStatus.SUSPENDED);
        assertThrows(InvalidStateException.class, () -> ledger.sendPurchaseRequest(
            merchant.getId(), customer.getId(), "Lamp", null, 1, money("10.00")));
    }
}
