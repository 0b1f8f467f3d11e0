package com.flagship.bnpl_ledger.orchestration;

import com.flagship.bnpl_ledger.credit.CreditLedgerService;
import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.exception.ConcurrencyConflictException;
import com.flagship.bnpl_ledger.exception.InsufficientCreditException;
import com.flagship.bnpl_ledger.observability.LedgerMetrics;
import com.flagship.bnpl_ledger.payment.PaymentService;
import com.flagship.bnpl_ledger.purchase.PurchaseRequestService;
import com.flagship.bnpl_ledger.settlement.MerchantService;
import com.flagship.bnpl_ledger.settlement.SettlementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Retry behavior of the write facade, with a real retry template and mocked services.
 */
@ExtendWith(MockitoExtension.class)
class LedgerOperationsTest {

    @Mock
    private LedgerMetrics ledgerMetrics;
    @Mock
    private CreditLedgerService creditLedgerService;
    @Mock
    private MerchantService merchantService;
    @Mock
    private PurchaseRequestService purchaseRequestService;
    @Mock
    private PurchaseAcceptanceService acceptanceService;
    @Mock
    private PaymentService paymentService;
    @Mock
    private SettlementService settlementService;

    private LedgerOperations operations;

    @BeforeEach
    void setUp() {
        RetryTemplate retryTemplate = RetryTemplate.builder()
            .maxAttempts(3)
            .fixedBackoff(1)
            .retryOn(org.springframework.dao.ConcurrencyFailureException.class)
            .traversingCauses()
            .build();
        operations = new LedgerOperations(retryTemplate, ledgerMetrics, creditLedgerService, merchantService,
            purchaseRequestService, acceptanceService, paymentService, settlementService);
    }

    @Test
    @DisplayName("A lock conflict is retried and the second attempt's result returned")
    void testRetriesLockConflict() {
        Customer customer = Customer.register(UUID.randomUUID(), "ABCD1234", new BigDecimal("100.00"),
            Instant.parse("2026-01-01T00:00:00Z"));
        when(creditLedgerService.registerCustomer(any()))
            .thenThrow(new CannotAcquireLockException("row locked"))
            .thenReturn(customer);

        Customer result = operations.registerCustomer(new BigDecimal("100.00"));

        assertSame(customer, result);
        verify(creditLedgerService, times(2)).registerCustomer(any());
        verify(ledgerMetrics).recordConcurrencyRetry("register_customer");
        verify(ledgerMetrics).recordLatency(eq("register_customer"), eq("success"), anyLong());
    }

    @Test
    @DisplayName("Exhausted retries surface as a busy conflict")
    void testGivesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        ConcurrencyConflictException e = assertThrows(ConcurrencyConflictException.class,
            () -> operations.execute("accept_purchase", () -> {
                attempts.incrementAndGet();
                throw new ObjectOptimisticLockingFailureException("Customer", UUID.randomUUID());
            }));

        assertEquals(3, attempts.get());
        assertInstanceOf(ObjectOptimisticLockingFailureException.class, e.getCause());
        verify(ledgerMetrics, times(2)).recordConcurrencyRetry("accept_purchase");
        verify(ledgerMetrics).recordLatency(eq("accept_purchase"), eq("busy"), anyLong());
    }

    @Test
    @DisplayName("Business rule failures are never retried")
    void testBusinessRuleNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(InsufficientCreditException.class, () -> operations.execute("accept_purchase", () -> {
            attempts.incrementAndGet();
            throw new InsufficientCreditException(UUID.randomUUID(), BigDecimal.TEN, BigDecimal.ONE);
        }));

        assertEquals(1, attempts.get());
        verify(ledgerMetrics, never()).recordConcurrencyRetry(any());
        verify(ledgerMetrics).recordLatency(eq("accept_purchase"), eq("rejected"), anyLong());
    }

    @Test
    void testIntegrityViolationNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(DataIntegrityViolationException.class, () -> operations.execute("make_payment", () -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        }));

        assertEquals(1, attempts.get());
        verify(ledgerMetrics).recordLatency(eq("make_payment"), eq("error"), anyLong());
    }
}
