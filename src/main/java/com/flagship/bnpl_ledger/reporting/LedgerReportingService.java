package com.flagship.bnpl_ledger.reporting;

import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import com.flagship.bnpl_ledger.exception.ResourceNotFoundException;
import com.flagship.bnpl_ledger.installment.InstallmentStatus;
import com.flagship.bnpl_ledger.money.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only aggregate queries over the ledger tables.
 *
 * These are derived views: they never lock and may trail a concurrent write by one commit.
 * An installment counts as overdue when it is unsettled and its due date is before today (UTC),
 * regardless of whether the maintenance sweep has flagged it.
 */
@Service
@RequiredArgsConstructor
public class LedgerReportingService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private static final String INSTALLMENT_SELECT =
        "SELECT s.id, t.id AS transaction_id, t.transaction_number, t.customer_id, t.merchant_id, " +
        "s.installment_number, s.amount, s.paid_amount, s.due_date, s.status " +
        "FROM repayment_schedules s " +
        "JOIN repayment_plans p ON p.id = s.plan_id " +
        "JOIN transactions t ON t.id = p.transaction_id " +
        "WHERE s.status IN ('PENDING', 'OVERDUE') ";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * Unsettled installments of one customer due from today up to {@code days} days ahead.
     */
    @Transactional(readOnly = true)
    public List<InstallmentView> upcomingInstallments(UUID customerId, int days) {
        if (days < 0) {
            throw new LedgerValidationException("Days must not be negative");
        }
        LocalDate today = LocalDate.now(clock);
        return jdbcTemplate.query(
            INSTALLMENT_SELECT + "AND t.customer_id = ? AND s.due_date >= ? AND s.due_date <= ? " +
            "ORDER BY s.due_date, s.installment_number",
            installmentRowMapper(today),
            customerId, today, today.plusDays(days)
        );
    }

    /**
     * Past-due installments, of one customer or of everyone when {@code customerId} is null.
     */
    @Transactional(readOnly = true)
    public List<InstallmentView> overdueInstallments(UUID customerId) {
        LocalDate today = LocalDate.now(clock);
        if (customerId == null) {
            return jdbcTemplate.query(
                INSTALLMENT_SELECT + "AND s.due_date < ? ORDER BY s.due_date, t.transaction_number",
                installmentRowMapper(today),
                today
            );
        }
        return jdbcTemplate.query(
            INSTALLMENT_SELECT + "AND t.customer_id = ? AND s.due_date < ? ORDER BY s.due_date, s.installment_number",
            installmentRowMapper(today),
            customerId, today
        );
    }

    /**
     * Percentage of paid installments that were paid on or before their due date; 100 when
     * nothing has been paid yet.
     */
    @Transactional(readOnly = true)
    public BigDecimal onTimePaymentRate(UUID customerId) {
        Map<String, Object> counts = jdbcTemplate.queryForMap(
            "SELECT COUNT(*) AS paid, " +
            "COUNT(*) FILTER (WHERE CAST(s.paid_at AT TIME ZONE 'UTC' AS DATE) <= s.due_date) AS on_time " +
            "FROM repayment_schedules s " +
            "JOIN repayment_plans p ON p.id = s.plan_id " +
            "WHERE p.customer_id = ? AND s.status = 'PAID'",
            customerId
        );
        long paid = ((Number) counts.get("paid")).longValue();
        long onTime = ((Number) counts.get("on_time")).longValue();
        if (paid == 0) {
            return HUNDRED.setScale(Money.SCALE);
        }
        return BigDecimal.valueOf(onTime).multiply(HUNDRED)
            .divide(BigDecimal.valueOf(paid), Money.SCALE, RoundingMode.HALF_UP);
    }

    @Transactional(readOnly = true)
    public MerchantStats merchantStats(UUID merchantId) {
        List<Map<String, Object>> merchant = jdbcTemplate.queryForList(
            "SELECT balance, total_commission_paid, total_transactions, total_volume FROM merchants WHERE id = ?",
            merchantId
        );
        if (merchant.isEmpty()) {
            throw new ResourceNotFoundException("Merchant", merchantId);
        }
        Map<String, Object> row = merchant.get(0);

        LocalDate today = LocalDate.now(clock);
        OffsetDateTime monthStart = today.withDayOfMonth(1).atStartOfDay().atOffset(ZoneOffset.UTC);

        Map<String, Object> transactions = jdbcTemplate.queryForMap(
            "SELECT COUNT(*) FILTER (WHERE status IN ('ACTIVE', 'OVERDUE')) AS active, " +
            "COUNT(*) FILTER (WHERE status = 'COMPLETED') AS completed " +
            "FROM transactions WHERE merchant_id = ?",
            merchantId
        );
        Map<String, Object> settlements = jdbcTemplate.queryForMap(
            "SELECT " +
            "COALESCE(SUM(net_amount) FILTER (WHERE settlement_type = 'INCOME'), 0) AS income, " +
            "COALESCE(SUM(net_amount) FILTER (WHERE settlement_type = 'WITHDRAWAL' AND status = 'COMPLETED'), 0) AS withdrawn, " +
            "COALESCE(SUM(net_amount) FILTER (WHERE settlement_type = 'WITHDRAWAL' AND status IN ('PENDING', 'PROCESSING')), 0) AS pending, " +
            "COALESCE(SUM(net_amount) FILTER (WHERE settlement_type = 'WITHDRAWAL' AND status <> 'FAILED' AND created_at >= ?), 0) AS this_month " +
            "FROM settlements WHERE merchant_id = ?",
            monthStart, merchantId
        );

        return MerchantStats.builder()
            .totalTransactions(((Number) row.get("total_transactions")).longValue())
            .totalVolume(money(row.get("total_volume")))
            .activeTransactions(((Number) transactions.get("active")).longValue())
            .completedTransactions(((Number) transactions.get("completed")).longValue())
            .totalIncome(money(settlements.get("income")))
            .totalCommission(money(row.get("total_commission_paid")))
            .totalWithdrawn(money(settlements.get("withdrawn")))
            .pendingWithdrawals(money(settlements.get("pending")))
            .withdrawnThisMonth(money(settlements.get("this_month")))
            .balance(money(row.get("balance")))
            .build();
    }

    /**
     * Completed income between two UTC dates, both included. Either bound may be null.
     */
    @Transactional(readOnly = true)
    public PlatformRevenue platformRevenue(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new LedgerValidationException("'from' must not be after 'to'");
        }
        StringBuilder sql = new StringBuilder(
            "SELECT COUNT(*) AS count, COALESCE(SUM(gross_amount), 0) AS gross, " +
            "COALESCE(SUM(commission_amount), 0) AS commission, COALESCE(SUM(net_amount), 0) AS net " +
            "FROM settlements WHERE settlement_type = 'INCOME' AND status = 'COMPLETED'");
        List<Object> args = new ArrayList<>();
        if (from != null) {
            sql.append(" AND created_at >= ?");
            args.add(from.atStartOfDay().atOffset(ZoneOffset.UTC));
        }
        if (to != null) {
            sql.append(" AND created_at < ?");
            args.add(to.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC));
        }

        Map<String, Object> row = jdbcTemplate.queryForMap(sql.toString(), args.toArray());
        return new PlatformRevenue(from, to, ((Number) row.get("count")).longValue(),
            money(row.get("gross")), money(row.get("commission")), money(row.get("net")));
    }

    private RowMapper<InstallmentView> installmentRowMapper(LocalDate today) {
        return (rs, rowNum) -> {
            LocalDate dueDate = rs.getObject("due_date", LocalDate.class);
            BigDecimal amount = rs.getBigDecimal("amount");
            BigDecimal paid = rs.getBigDecimal("paid_amount");
            boolean overdue = dueDate.isBefore(today);
            return new InstallmentView(
                UUID.fromString(rs.getString("id")),
                UUID.fromString(rs.getString("transaction_id")),
                rs.getString("transaction_number"),
                UUID.fromString(rs.getString("customer_id")),
                UUID.fromString(rs.getString("merchant_id")),
                rs.getInt("installment_number"),
                amount,
                paid,
                amount.subtract(paid),
                dueDate,
                overdue ? InstallmentStatus.OVERDUE : InstallmentStatus.valueOf(rs.getString("status")),
                overdue ? ChronoUnit.DAYS.between(dueDate, today) : 0
            );
        };
    }

    private static BigDecimal money(Object value) {
        if (value == null) {
            return Money.ZERO;
        }
        return ((BigDecimal) value).setScale(Money.SCALE, RoundingMode.UNNECESSARY);
    }
}
