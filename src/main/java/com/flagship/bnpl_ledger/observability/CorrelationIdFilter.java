package com.flagship.bnpl_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs every API request under a correlation id taken from {@code X-Correlation-ID} (or generated)
 * and echoed back in the response.
 *
 * When the path addresses a single ledger entity, e.g. {@code /api/merchants/{id}/withdrawals} or
 * {@code /api/admin/settlements/{id}/complete}, its id is put in the MDC before the controller runs,
 * so even a request rejected during validation logs which entity it was about.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern ENTITY_PATH = Pattern.compile(
        "^/api/(?:admin/)?(customers|merchants|purchase-requests|transactions|settlements)/"
            + "([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})(?:/.*)?$");

    private static final Map<String, String> MDC_KEY_BY_COLLECTION = Map.of(
        "customers", CorrelationContext.CUSTOMER_ID_MDC_KEY,
        "merchants", CorrelationContext.MERCHANT_ID_MDC_KEY,
        "purchase-requests", CorrelationContext.REQUEST_ID_MDC_KEY,
        "transactions", CorrelationContext.TRANSACTION_ID_MDC_KEY,
        "settlements", CorrelationContext.SETTLEMENT_ID_MDC_KEY);

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = CorrelationContext.begin(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
        try {
            tagEntity(request.getRequestURI().substring(request.getContextPath().length()));
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.end();
        }
    }

    static void tagEntity(String path) {
        Matcher matcher = ENTITY_PATH.matcher(path);
        if (matcher.matches()) {
            CorrelationContext.putEntity(MDC_KEY_BY_COLLECTION.get(matcher.group(1)), UUID.fromString(matcher.group(2)));
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Actuator scrapes would only add noise
        return request.getRequestURI().startsWith("/actuator");
    }
}
