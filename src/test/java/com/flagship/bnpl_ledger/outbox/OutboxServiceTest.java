package com.flagship.bnpl_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bnpl_ledger.credit.Customer;
import com.flagship.bnpl_ledger.event.EventAggregates;
import com.flagship.bnpl_ledger.event.PurchaseAcceptedEvent;
import com.flagship.bnpl_ledger.event.PurchaseRequestCreatedEvent;
import com.flagship.bnpl_ledger.exception.InsufficientCreditException;
import com.flagship.bnpl_ledger.orchestration.AcceptanceResult;
import com.flagship.bnpl_ledger.purchase.PurchaseRequest;
import com.flagship.bnpl_ledger.settlement.Merchant;
import com.flagship.bnpl_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger events are written in the same transaction as the balance change that caused them.
 */
class OutboxServiceTest extends IntegrationTestSupport {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Accepting a purchase writes the acceptance event with the plan in its payload")
    void testAcceptanceEventPayload() throws Exception {
        printTestHeader("Acceptance event payload");
        Customer customer = customer("5000.00");
        Merchant merchant = merchant();
        AcceptanceResult result = accepted(merchant, customer, "3999.00", 3);

        List<OutboxEvent> events = outboxService.getEventsForAggregate(EventAggregates.TRANSACTION,
            result.getTransaction().getId());
        assertEquals(1, events.size());
        OutboxEvent event = events.get(0);
        printOutput("Payload", event.getPayload());

        assertEquals(PurchaseAcceptedEvent.EVENT_TYPE, event.getEventType());
        assertNull(event.getPublishedAt());
        assertEquals(0, event.getRetryCount());
        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals("3999.00", payload.get("totalAmount").asText());
        assertEquals(3, payload.get("numberOfInstallments").asInt());
        printSuccess("Event written with the transaction");
    }

    @Test
    @DisplayName("A rolled-back operation leaves no event")
    void testRollbackLeavesNoEvent() {
        Customer customer = customer("1000.00");
        Merchant merchant = merchant();
        PurchaseRequest first = purchase(merchant, customer, 1, "800.00");
        PurchaseRequest second = purchase(merchant, customer, 1, "800.00");
        ledger.acceptPurchase(first.getId(), customer.getId(), 1);
        long before = outboxEventRepository.count();

        assertThrows(InsufficientCreditException.class,
            () -> ledger.acceptPurchase(second.getId(), customer.getId(), 1));

        assertEquals(before, outboxEventRepository.count());
        assertEquals(2, outboxEventRepository.findByEventTypeOrderBySequenceNumberAsc(
            PurchaseRequestCreatedEvent.EVENT_TYPE).size());
    }

    @Test
    @DisplayName("Saving an event outside a transaction is refused")
    void testSaveRequiresTransaction() {
        Customer customer = customer("1000.00");

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(
            PurchaseRequestCreatedEvent.from(purchase(merchant(), customer, 1, "10.00"))));
    }

    @Test
    @DisplayName("Failed events are retried until max retries, then left as dead letters")
    void testRetryCountingAndDeadLetters() {
        Customer customer = customer("1000.00");
        purchase(merchant(), customer, 1, "10.00");
        List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10, 2);
        assertEquals(1, pending.size());
        OutboxEvent event = pending.get(0);

        outboxService.markFailed(event.getId(), "broker down");
        assertEquals(1, outboxService.findUnpublishedEvents(10, 2).size());

        outboxService.markFailed(event.getId(), "broker down");
        assertTrue(outboxService.findUnpublishedEvents(10, 2).isEmpty());

        OutboxEventEntity stored = outboxEventRepository.findById(event.getId()).orElseThrow();
        assertEquals(2, stored.getRetryCount());
        assertEquals("broker down", stored.getLastError());
        assertEquals(1, outboxService.countUnpublished());

        outboxService.markPublished(event.getId());
        assertEquals(0, outboxService.countUnpublished());
    }
}
