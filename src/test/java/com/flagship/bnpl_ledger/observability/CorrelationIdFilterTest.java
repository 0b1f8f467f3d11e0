package com.flagship.bnpl_ledger.observability;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void clearContext() {
        CorrelationContext.end();
    }

    private Map<String, String> handle(MockHttpServletRequest request, MockHttpServletResponse response)
            throws Exception {
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            if (context != null) {
                seen.putAll(context);
            }
            assertTrue(CorrelationContext.hasCorrelationId());
        };
        filter.doFilter(request, response, chain);
        return seen;
    }

    @Test
    @DisplayName("An incoming correlation id is used for the request and echoed back")
    void testIncomingIdIsEchoed() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/customers");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = handle(request, response);

        assertEquals("abc-123", seen.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertEquals("abc-123", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }

    @Test
    void testMissingIdIsGenerated() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        Map<String, String> seen = handle(new MockHttpServletRequest("GET", "/api/customers"), response);

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
        assertEquals(generated, seen.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("The entity addressed by the path is tagged in the MDC while the request runs")
    void testEntityFromPathIsTagged() throws Exception {
        UUID merchantId = UUID.randomUUID();
        UUID settlementId = UUID.randomUUID();

        Map<String, String> merchantRequest = handle(
            new MockHttpServletRequest("POST", "/api/merchants/" + merchantId + "/withdrawals"),
            new MockHttpServletResponse());
        Map<String, String> adminRequest = handle(
            new MockHttpServletRequest("POST", "/api/admin/settlements/" + settlementId + "/complete"),
            new MockHttpServletResponse());

        assertEquals(merchantId.toString(), merchantRequest.get(CorrelationContext.MERCHANT_ID_MDC_KEY));
        assertEquals(settlementId.toString(), adminRequest.get(CorrelationContext.SETTLEMENT_ID_MDC_KEY));
        assertNull(adminRequest.get(CorrelationContext.MERCHANT_ID_MDC_KEY));
    }

    @Test
    void testPathsWithoutEntityIdTagNothing() throws Exception {
        Map<String, String> seen = handle(
            new MockHttpServletRequest("GET", "/api/customers/not-a-uuid/transactions"),
            new MockHttpServletResponse());
        Map<String, String> listing = handle(
            new MockHttpServletRequest("GET", "/api/admin/limit-requests"), new MockHttpServletResponse());

        assertNull(seen.get(CorrelationContext.CUSTOMER_ID_MDC_KEY));
        assertEquals(1, listing.size());
    }

    @Test
    @DisplayName("Nothing of the request is left on the thread afterwards")
    void testContextIsClearedAfterRequest() throws Exception {
        MDC.put(CorrelationContext.CUSTOMER_ID_MDC_KEY, "left-over");

        handle(new MockHttpServletRequest("GET", "/api/transactions/" + UUID.randomUUID()),
            new MockHttpServletResponse());

        assertFalse(CorrelationContext.hasCorrelationId());
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.TRANSACTION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.CUSTOMER_ID_MDC_KEY));
    }
}
