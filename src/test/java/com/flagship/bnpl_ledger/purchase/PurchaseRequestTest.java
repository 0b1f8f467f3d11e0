package com.flagship.bnpl_ledger.purchase;

import com.flagship.bnpl_ledger.exception.InvalidAmountException;
import com.flagship.bnpl_ledger.exception.InvalidStateException;
import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PurchaseRequestTest {

    private static final Instant NOW = Instant.parse("2026-02-10T08:00:00Z");
    private static final Duration EXPIRY = Duration.ofHours(24);

    private PurchaseRequest pending() {
        return PurchaseRequest.create("PR-20260210-000001", UUID.randomUUID(), UUID.randomUUID(),
            " Laptop ", "15 inch", 3, new BigDecimal("1333.00"), NOW, EXPIRY);
    }

    @Test
    @DisplayName("Total is quantity times unit price and expiry is 24h out")
    void testCreate() {
        PurchaseRequest request = pending();

        assertEquals(new BigDecimal("3999.00"), request.getTotalAmount());
        assertEquals("Laptop", request.getProductName());
        assertEquals(PurchaseRequestStatus.PENDING, request.getStatus());
        assertEquals(NOW.plus(EXPIRY), request.getExpiresAt());
    }

    @Test
    void testCreateValidation() {
        UUID id = UUID.randomUUID();
        assertThrows(LedgerValidationException.class, () -> PurchaseRequest.create("R", id, id, " ", null, 1,
            BigDecimal.TEN, NOW, EXPIRY));
        assertThrows(LedgerValidationException.class, () -> PurchaseRequest.create("R", id, id, "x", null, 0,
            BigDecimal.TEN, NOW, EXPIRY));
        assertThrows(InvalidAmountException.class, () -> PurchaseRequest.create("R", id, id, "x", null, 1,
            new BigDecimal("0.00"), NOW, EXPIRY));
        assertThrows(LedgerValidationException.class, () -> PurchaseRequest.create("R", id, id, "x".repeat(256),
            null, 1, BigDecimal.TEN, NOW, EXPIRY));
    }

    @Test
    @DisplayName("A request is expired exactly at expires_at, not a moment before")
    void testExpiryBoundary() {
        PurchaseRequest request = pending();
        Instant expiresAt = request.getExpiresAt();

        assertFalse(request.isExpired(expiresAt.minusMillis(1)));
        assertTrue(request.isExpired(expiresAt));
        assertEquals(PurchaseRequestStatus.PENDING, request.effectiveStatus(expiresAt.minusMillis(1)));
        assertEquals(PurchaseRequestStatus.EXPIRED, request.effectiveStatus(expiresAt));
        assertEquals(PurchaseRequestStatus.EXPIRED, request.asOf(expiresAt.plusSeconds(1)).getStatus());
        assertSame(request, request.asOf(NOW));
    }

    @Test
    void testAccept() {
        UUID transactionId = UUID.randomUUID();
        PurchaseRequest accepted = pending().accept(transactionId, NOW.plusSeconds(30));

        assertEquals(PurchaseRequestStatus.ACCEPTED, accepted.getStatus());
        assertEquals(transactionId, accepted.getTransactionId());
        assertEquals(NOW.plusSeconds(30), accepted.getAcceptedAt());
        assertFalse(accepted.isExpired(accepted.getExpiresAt().plusSeconds(1)));
    }

    @Test
    void testRejectAndCancel() {
        PurchaseRequest rejected = pending().reject("Changed my mind", NOW);
        assertEquals("Changed my mind", rejected.getRejectionReason());
        assertNotNull(rejected.getRejectedAt());

        PurchaseRequest cancelled = pending().cancel(NOW);
        assertEquals(PurchaseRequestStatus.CANCELLED, cancelled.getStatus());
        assertNotNull(cancelled.getCancelledAt());
    }

    @ParameterizedTest
    @EnumSource(value = PurchaseRequestStatus.class, names = {"ACCEPTED", "REJECTED", "EXPIRED", "CANCELLED"})
    @DisplayName("Terminal requests refuse every transition")
    void testTerminalStatesAreFinal(PurchaseRequestStatus terminal) {
        PurchaseRequest request = switch (terminal) {
            case ACCEPTED -> pending().accept(UUID.randomUUID(), NOW);
            case REJECTED -> pending().reject(null, NOW);
            case EXPIRED -> pending().expire(NOW);
            case CANCELLED -> pending().cancel(NOW);
            case PENDING -> throw new IllegalArgumentException();
        };

        assertTrue(request.isTerminal());
        assertThrows(InvalidStateException.class, () -> request.accept(UUID.randomUUID(), NOW));
        assertThrows(InvalidStateException.class, () -> request.reject("x", NOW));
        assertThrows(InvalidStateException.class, () -> request.cancel(NOW));
        assertThrows(InvalidStateException.class, () -> request.expire(NOW));
        for (PurchaseRequestStatus target : PurchaseRequestStatus.values()) {
            assertFalse(request.canTransitionTo(target));
        }
    }
}
