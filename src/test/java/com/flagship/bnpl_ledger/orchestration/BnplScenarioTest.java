package com.flagship.bnpl_ledger.orchestration;

import com.flagship.bnpl_ledger.credit.CreditLedgerService;
import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.event.EventAggregates;
import com.flagship.bnpl_ledger.event.InstallmentPaymentRecordedEvent;
import com.flagship.bnpl_ledger.event.PurchaseAcceptedEvent;
import com.flagship.bnpl_ledger.event.TransactionCompletedEvent;
import com.flagship.bnpl_ledger.exception.InsufficientBalanceException;
import com.flagship.bnpl_ledger.exception.InsufficientCreditException;
import com.flagship.bnpl_ledger.exception.RequestExpiredException;
import com.flagship.bnpl_ledger.installment.InstallmentStatus;
import com.flagship.bnpl_ledger.installment.PlanSchedule;
import com.flagship.bnpl_ledger.installment.PlanStatus;
import com.flagship.bnpl_ledger.installment.RepaymentPlanService;
import com.flagship.bnpl_ledger.installment.ScheduleRow;
import com.flagship.bnpl_ledger.outbox.OutboxEvent;
import com.flagship.bnpl_ledger.outbox.OutboxService;
import com.flagship.bnpl_ledger.payment.PaymentMethod;
import com.flagship.bnpl_ledger.payment.PaymentResult;
import com.flagship.bnpl_ledger.purchase.PurchaseRequest;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestService;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestStatus;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.settlement.MerchantService;
import com.flagship.bnpl_ledger.settlement.Settlement;
import com.flagship.bnpl_ledger.settlement.SettlementStatus;
import com.flagship.bnpl_ledger.settlement.SettlementType;
import com.flagship.bnpl_ledger.support.IntegrationTestSupport;
import com.flagship.bnpl_ledger.transaction.Transaction;
import com.flagship.bnpl_ledger.transaction.TransactionService;
import com.flagship.bnpl_ledger.transaction.TransactionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end ledger flows: accept, pay, expire and withdraw against a real database.
 */
class BnplScenarioTest extends IntegrationTestSupport {

    @Autowired
    private CreditLedgerService creditLedgerService;

    @Autowired
    private MerchantService merchantService;

    @Autowired
    private PurchaseRequestService purchaseRequestService;

    @Autowired
    private TransactionService transactionService;

    @Autowired
    private RepaymentPlanService planService;

    @Autowired
    private OutboxService outboxService;

    @Test
    @DisplayName("3999.00 on 3 installments: even schedule, first payment leaves 2666.00")
    void testThreeEvenInstallments() {
        printTestHeader("Accept 3999.00 on a 3-month plan and pay the first installment");
        Customer customer = customer("5000.00");
        Merchant merchant = merchant();

        PurchaseRequest request = purchase(merchant, customer, 3, "1333.00");
        printInput("Purchase request total", request.getTotalAmount());
        AcceptanceResult result = ledger.acceptPurchase(request.getId(), customer.getId(), 3);

        List<ScheduleRow> rows = result.getSchedule().getRows();
        rows.forEach(row -> printOutput("Installment #" + row.getInstallmentNumber(), row.getAmount() + " due " + row.getDueDate()));
        assertEquals(3, rows.size());
        rows.forEach(row -> assertEquals(money("1333.00"), row.getAmount()));
        assertEquals(LocalDate.of(2026, 2, 15), rows.get(0).getDueDate());
        assertEquals(LocalDate.of(2026, 4, 15), result.getTransaction().getDueDate());
        assertEquals(PurchaseRequestStatus.ACCEPTED, result.getPurchaseRequest().getStatus());
        assertEquals(result.getTransaction().getId(), result.getPurchaseRequest().getTransactionId());

        Customer afterAccept = creditLedgerService.getCustomer(customer.getId());
        assertEquals(money("1001.00"), afterAccept.getAvailableBalance());
        assertEquals(money("3999.00"), afterAccept.getOutstandingBalance());

        PaymentResult payment = ledger.makePayment(result.getTransaction().getId(), customer.getId(),
            money("1333.00"), PaymentMethod.CARD, null);
        printOutput("Remaining balance", payment.getTransaction().getRemainingBalance());

        assertEquals(money("2666.00"), payment.getTransaction().getRemainingBalance());
        assertEquals(1, payment.getPayment().getInstallmentsCovered());
        assertEquals(TransactionStatus.ACTIVE, payment.getTransaction().getStatus());

        PlanSchedule plan = planService.getPlan(result.getTransaction().getId());
        assertEquals(InstallmentStatus.PAID, plan.getRows().get(0).getStatus());
        assertEquals(InstallmentStatus.PENDING, plan.getRows().get(1).getStatus());
        assertEquals(1, plan.getPlan().getInstallmentsPaid());
        assertEquals(LocalDate.of(2026, 3, 15), plan.getPlan().getNextPaymentDate());

        Customer afterPayment = creditLedgerService.getCustomer(customer.getId());
        assertEquals(money("2334.00"), afterPayment.getAvailableBalance());
        assertEquals(money("2666.00"), afterPayment.getOutstandingBalance());
        printSuccess("Schedule and balances match");
    }

    @Test
    @DisplayName("Accepting the whole limit leaves nothing for a second accept")
    void testCreditExhaustion() {
        printTestHeader("Exhaust a 2000.00 credit line");
        Customer customer = customer("2000.00");
        Merchant merchant = merchant();

        PurchaseRequest first = purchase(merchant, customer, 1, "2000.00");
        PurchaseRequest second = purchase(merchant, customer, 1, "1.00");
        ledger.acceptPurchase(first.getId(), customer.getId(), 1);

        Customer exhausted = creditLedgerService.getCustomer(customer.getId());
        printOutput("Available / outstanding", exhausted.getAvailableBalance() + " / " + exhausted.getOutstandingBalance());
        assertEquals(money("0.00"), exhausted.getAvailableBalance());
        assertEquals(money("2000.00"), exhausted.getOutstandingBalance());

        assertThrows(InsufficientCreditException.class,
            () -> ledger.acceptPurchase(second.getId(), customer.getId(), 1));
        assertEquals(PurchaseRequestStatus.PENDING,
            purchaseRequestService.getPurchaseRequest(second.getId()).getStatus());
        assertThrows(InsufficientCreditException.class, () -> purchase(merchant, customer, 1, "0.01"));
        printSuccess("Second accept rejected with INSUFFICIENT_CREDIT");
    }

    @Test
    @DisplayName("Paying 1000.00 at once settles 333.33/333.33/333.34 and completes the transaction")
    void testFullPayoffWithRemainderRow() {
        printTestHeader("One-shot payoff of an uneven schedule");
        Customer customer = customer("2000.00");
        Merchant merchant = merchant();
        AcceptanceResult result = accepted(merchant, customer, "1000.00", 3);

        List<ScheduleRow> rows = result.getSchedule().getRows();
        assertEquals(money("333.33"), rows.get(0).getAmount());
        assertEquals(money("333.33"), rows.get(1).getAmount());
        assertEquals(money("333.34"), rows.get(2).getAmount());

        PaymentResult payment = ledger.makePayment(result.getTransaction().getId(), customer.getId(),
            money("1000.00"), PaymentMethod.WALLET, null);

        assertEquals(3, payment.getAllocations().size());
        assertEquals(TransactionStatus.COMPLETED, payment.getTransaction().getStatus());
        assertNotNull(payment.getTransaction().getCompletedAt());

        PlanSchedule plan = planService.getPlan(result.getTransaction().getId());
        assertEquals(PlanStatus.COMPLETED, plan.getPlan().getStatus());
        assertTrue(plan.getRows().stream().allMatch(row -> row.getStatus() == InstallmentStatus.PAID));
        assertNull(plan.getPlan().getNextPaymentDate());

        Customer released = creditLedgerService.getCustomer(customer.getId());
        assertEquals(money("2000.00"), released.getAvailableBalance());
        assertEquals(money("0.00"), released.getOutstandingBalance());

        List<String> eventTypes = outboxService
            .getEventsForAggregate(EventAggregates.TRANSACTION, result.getTransaction().getId())
            .stream()
            .map(OutboxEvent::getEventType)
            .toList();
        printOutput("Transaction events", eventTypes);
        assertEquals(List.of(PurchaseAcceptedEvent.EVENT_TYPE, InstallmentPaymentRecordedEvent.EVENT_TYPE,
            TransactionCompletedEvent.EVENT_TYPE), eventTypes);
        printSuccess("Transaction completed and 1000.00 of credit released");
    }

    @Test
    @DisplayName("A request past its expiry cannot be accepted and reads EXPIRED")
    void testExpiredRequest() {
        printTestHeader("Accept after expiry");
        Customer customer = customer("2000.00");
        Merchant merchant = merchant();
        PurchaseRequest request = purchase(merchant, customer, 1, "500.00");

        clock.advance(Duration.ofHours(25));
        assertEquals(PurchaseRequestStatus.EXPIRED,
            purchaseRequestService.getPurchaseRequest(request.getId()).getStatus());

        RequestExpiredException e = assertThrows(RequestExpiredException.class,
            () -> ledger.acceptPurchase(request.getId(), customer.getId(), 3));
        printOutput("Error", e.getMessage());
        assertEquals("REQUEST_EXPIRED", e.getErrorCode());

        String stored = jdbcTemplate.queryForObject("SELECT status FROM purchase_requests WHERE id = ?",
            String.class, request.getId());
        assertEquals("EXPIRED", stored);
        Customer untouched = creditLedgerService.getCustomer(customer.getId());
        assertEquals(money("2000.00"), untouched.getAvailableBalance());
        assertTrue(transactionService.transactionsForCustomer(customer.getId(), null).isEmpty());
        printSuccess("Expiry persisted and no credit reserved");
    }

    @Test
    @DisplayName("Withdrawing more than the balance fails and leaves the balance alone")
    void testWithdrawalBeyondBalance() {
        printTestHeader("Withdraw 600.00 from a 500.00 balance");
        Customer customer = customer("2000.00");
        Merchant merchant = merchant();
        // 502.51 - round(502.51 * 0.005) = 500.00
        accepted(merchant, customer, "502.51", 1);
        assertEquals(money("500.00"), merchantService.getMerchant(merchant.getId()).getBalance());

        assertThrows(InsufficientBalanceException.class,
            () -> ledger.requestWithdrawal(merchant.getId(), money("600.00"), null));

        assertEquals(money("500.00"), merchantService.getMerchant(merchant.getId()).getBalance());
        printSuccess("Balance unchanged at 500.00");
    }

    @Test
    @DisplayName("Acceptance books the merchant's net income right away as a COMPLETED income settlement")
    void testIncomeAccrualOnAcceptance() {
        printTestHeader("Income accrual at acceptance");
        Customer customer = customer("5000.00");
        Merchant merchant = merchant();

        AcceptanceResult result = accepted(merchant, customer, "3999.00", 6);
        Transaction transaction = result.getTransaction();
        Settlement income = result.getIncomeSettlement();

        assertEquals(money("20.00"), transaction.getCommissionAmount());
        assertEquals(money("3979.00"), transaction.getNetAmount());
        assertEquals(0, new BigDecimal("0.005").compareTo(transaction.getCommissionRate()));
        assertEquals(SettlementType.INCOME, income.getSettlementType());
        assertEquals(SettlementStatus.COMPLETED, income.getStatus());
        assertEquals(transaction.getId(), income.getTransactionId());

        Merchant accrued = merchantService.getMerchant(merchant.getId());
        printOutput("Merchant balance", accrued.getBalance());
        assertEquals(money("3979.00"), accrued.getBalance());
        assertEquals(money("20.00"), accrued.getTotalCommissionPaid());
        assertEquals(money("3999.00"), accrued.getTotalVolume());
        assertEquals(1, accrued.getTotalTransactions());

        ledger.makePayment(transaction.getId(), customer.getId(), money("666.50"), PaymentMethod.CARD, null);
        assertEquals(money("3979.00"), merchantService.getMerchant(merchant.getId()).getBalance());
        printSuccess("Balance accrued once, payments do not move it");
    }
}
