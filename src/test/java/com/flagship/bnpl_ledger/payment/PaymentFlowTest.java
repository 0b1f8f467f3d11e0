package com.flagship.bnpl_ledger.payment;

import com.flagship.bnpl_ledger.credit.CreditLedgerService;
import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.exception.ForbiddenOperationException;
import com.flagship.bnpl_ledger.exception.InvalidAmountException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.exception.TransactionNotActiveException;
import com.flagship.bnpl_ledger.orchestration.AcceptanceResult;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Payments: validation, ownership and idempotent replay.
 */
class PaymentFlowTest extends IntegrationTestSupport {

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private CreditLedgerService creditLedgerService;

    private Customer customer;
    private AcceptanceResult purchase;

    @BeforeEach
    void openTransaction() {
        customer = customer("3000.00");
        Merchant merchant = merchant();
        purchase = accepted(merchant, customer, "1200.00", 3);
    }

    private UUID transactionId() {
        return purchase.getTransaction().getId();
    }

    @Test
    @DisplayName("Same idempotency key returns the first payment without applying again")
    void testIdempotentReplay() {
        printTestHeader("Idempotent payment replay");
        String key = "pay-" + UUID.randomUUID();
        printInput("Idempotency-Key", key);

        PaymentResult first = ledger.makePayment(transactionId(), customer.getId(), money("400.00"),
            PaymentMethod.CARD, key);
        PaymentResult second = ledger.makePayment(transactionId(), customer.getId(), money("400.00"),
            PaymentMethod.CARD, key);
        printOutput("First / second payment", first.getPayment().getId() + " / " + second.getPayment().getId());

        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getPayment().getId(), second.getPayment().getId());
        assertEquals(1, second.getAllocations().size());
        assertEquals(money("800.00"), second.getTransaction().getRemainingBalance());
        assertEquals(1, paymentService.paymentsForTransaction(transactionId()).size());
        assertEquals(money("800.00"), creditLedgerService.getCustomer(customer.getId()).getOutstandingBalance());
        printSuccess("Payment applied exactly once");
    }

    @Test
    @DisplayName("Replay still works from the database when the key is not cached")
    void testReplayFromDatabase() {
        String key = "pay-" + UUID.randomUUID();
        PaymentResult first = ledger.makePayment(transactionId(), customer.getId(), money("100.00"),
            PaymentMethod.WALLET, key);
        jdbcTemplate.update("UPDATE payments SET idempotency_key = ? WHERE id = ?", key + "-db",
            first.getPayment().getId());

        PaymentResult replay = ledger.makePayment(transactionId(), customer.getId(), money("100.00"),
            PaymentMethod.WALLET, key + "-db");

        assertTrue(replay.isReplayed());
        assertEquals(first.getPayment().getId(), replay.getPayment().getId());
    }

    @Test
    void testKeyReusedForAnotherTransactionIsRejected() {
        String key = "pay-" + UUID.randomUUID();
        ledger.makePayment(transactionId(), customer.getId(), money("100.00"), PaymentMethod.CARD, key);
        AcceptanceResult other = accepted(merchant(), customer, "300.00", 3);

        assertThrows(LedgerValidationException.class, () -> ledger.makePayment(other.getTransaction().getId(),
            customer.getId(), money("100.00"), PaymentMethod.CARD, key));
    }

    @Test
    @DisplayName("Concurrent payments with one key apply once")
    void testConcurrentSameKey() throws InterruptedException {
        printTestHeader("Concurrent duplicate payments");
        String key = "pay-" + UUID.randomUUID();
        int threads = 5;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ConcurrentLinkedQueue<UUID> paymentIds = new ConcurrentLinkedQueue<>();
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    paymentIds.add(ledger.makePayment(transactionId(), customer.getId(), money("400.00"),
                        PaymentMethod.CARD, key).getPayment().getId());
                } catch (Throwable e) {
                    errors.add(e);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Distinct payment ids", paymentIds.stream().distinct().count());
        printOutput("Errors", errors);
        assertEquals(1, paymentService.paymentsForTransaction(transactionId()).size());
        assertEquals(money("800.00"), creditLedgerService.getCustomer(customer.getId()).getOutstandingBalance());
        assertTrue(paymentIds.stream().distinct().count() <= 1);
        printSuccess("Exactly one payment recorded");
    }

    @Test
    @DisplayName("Concurrent payments that together exceed the remaining balance: exactly one applies")
    void testConcurrentOverpaymentIsRefused() throws InterruptedException {
        printTestHeader("Concurrent payments of 60% of remaining each");
        BigDecimal remaining = purchase.getTransaction().getRemainingBalance();
        BigDecimal share = remaining.multiply(new BigDecimal("0.60")).setScale(2, RoundingMode.HALF_UP);
        BigDecimal outstandingBefore = creditLedgerService.getCustomer(customer.getId()).getOutstandingBalance();
        printInput("Remaining / each payment", remaining + " / " + share);

        List<String> keys = List.of("pay-" + UUID.randomUUID(), "pay-" + UUID.randomUUID());
        ExecutorService executor = Executors.newFixedThreadPool(keys.size());
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(keys.size());
        AtomicInteger applied = new AtomicInteger();
        ConcurrentLinkedQueue<Throwable> errors = new ConcurrentLinkedQueue<>();

        for (String key : keys) {
            executor.submit(() -> {
                try {
                    start.await();
                    ledger.makePayment(transactionId(), customer.getId(), share, PaymentMethod.CARD, key);
                    applied.incrementAndGet();
                } catch (Throwable e) {
                    errors.add(e);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Applied", applied.get());
        printOutput("Errors", errors);
        assertEquals(1, applied.get());
        assertEquals(1, errors.size());
        assertInstanceOf(InvalidAmountException.class, errors.peek());

        BigDecimal paid = jdbcTemplate.queryForObject(
            "SELECT paid_amount FROM transactions WHERE id = ?", BigDecimal.class, transactionId());
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT total_amount FROM transactions WHERE id = ?", BigDecimal.class, transactionId());
        BigDecimal scheduled = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(s.paid_amount), 0) FROM repayment_schedules s "
                + "JOIN repayment_plans p ON p.id = s.plan_id WHERE p.transaction_id = ?",
            BigDecimal.class, transactionId());

        assertTrue(paid.compareTo(total) <= 0);
        assertEquals(0, share.compareTo(paid));
        assertEquals(0, paid.compareTo(scheduled));
        assertEquals(outstandingBefore.subtract(share),
            creditLedgerService.getCustomer(customer.getId()).getOutstandingBalance());
        assertEquals(1, paymentService.paymentsForTransaction(transactionId()).size());
        printSuccess("Only one payment applied, balances agree");
    }

    @Test
    @DisplayName("Payments are validated before anything changes")
    void testValidation() {
        assertThrows(InvalidAmountException.class, () -> ledger.makePayment(transactionId(), customer.getId(),
            money("1200.01"), PaymentMethod.CARD, null));
        assertThrows(InvalidAmountException.class, () -> ledger.makePayment(transactionId(), customer.getId(),
            money("0.00"), PaymentMethod.CARD, null));
        assertThrows(InvalidAmountException.class, () -> ledger.makePayment(transactionId(), customer.getId(),
            money("10.001"), PaymentMethod.CARD, null));
        assertThrows(LedgerValidationException.class, () -> ledger.makePayment(transactionId(), customer.getId(),
            money("10.00"), null, null));
        assertThrows(ResourceNotFoundException.class, () -> ledger.makePayment(unknownId(), customer.getId(),
            money("10.00"), PaymentMethod.CARD, null));

        Customer stranger = customer("100.00");
        assertThrows(ForbiddenOperationException.class, () -> ledger.makePayment(transactionId(), stranger.getId(),
            money("10.00"), PaymentMethod.CARD, null));

        assertTrue(paymentService.paymentsForTransaction(transactionId()).isEmpty());
        assertEquals(money("1200.00"), creditLedgerService.getCustomer(customer.getId()).getOutstandingBalance());
    }

    @Test
    void testCompletedTransactionRefusesPayments() {
        ledger.makePayment(transactionId(), customer.getId(), money("1200.00"), PaymentMethod.BANK_TRANSFER, null);

        assertThrows(TransactionNotActiveException.class, () -> ledger.makePayment(transactionId(),
            customer.getId(), money("1.00"), PaymentMethod.CARD, null));
    }

    @Test
    void testPaymentHistory() {
        ledger.makePayment(transactionId(), customer.getId(), money("100.00"), PaymentMethod.CARD, null);
        clock.advance(Duration.ofMinutes(5));
        ledger.makePayment(transactionId(), customer.getId(), money("500.00"), PaymentMethod.CARD, null);

        List<Payment> history = paymentService.paymentsForCustomer(customer.getId());
        assertEquals(2, history.size());
        PaymentResult second = paymentService.getPayment(history.get(0).getId());
        assertEquals(2, second.getAllocations().size());
        assertEquals(money("600.00"), second.getTransaction().getPaidAmount());
    }
}
