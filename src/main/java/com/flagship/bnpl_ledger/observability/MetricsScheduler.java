package com.flagship.bnpl_ledger.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Refreshes the gauges that need a database query, so a scrape never touches the database.
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private static final String PENDING_LIMIT_REQUESTS_SQL =
            "SELECT COUNT(*) FROM customer_limit_history WHERE status = 'PENDING'";
    private static final String OPEN_WITHDRAWALS_SQL =
            "SELECT COUNT(*) FROM settlements WHERE settlement_type = 'WITHDRAWAL' AND status IN ('PENDING', 'PROCESSING')";
    private static final String PAST_DUE_INSTALLMENTS_SQL =
            "SELECT COUNT(*) FROM repayment_schedules WHERE status IN ('PENDING', 'OVERDUE') AND due_date < ?";

    private final OutboxMetrics outboxMetrics;
    private final LedgerMetrics ledgerMetrics;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        outboxMetrics.refreshMetrics();
        refreshLedgerBacklog();
    }

    void refreshLedgerBacklog() {
        try {
            LocalDate today = LocalDate.now(clock);
            ledgerMetrics.updateBacklog(
                    count(PENDING_LIMIT_REQUESTS_SQL),
                    count(OPEN_WITHDRAWALS_SQL),
                    count(PAST_DUE_INSTALLMENTS_SQL, Date.valueOf(today)));
        } catch (DataAccessException e) {
            log.warn("Could not refresh ledger backlog gauges: {}", e.getMessage());
        }
    }

    private long count(String sql, Object... args) {
        Long value = jdbcTemplate.queryForObject(sql, Long.class, args);
        return value == null ? 0 : value;
    }
}
