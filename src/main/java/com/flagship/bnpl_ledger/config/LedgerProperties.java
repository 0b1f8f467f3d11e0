package com.flagship.bnpl_ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Business limits and tuning knobs for the ledger, bound from the {@code ledger.*} keys.
 *
 * Defaults match the production configuration so that plain unit tests can use
 * {@code new LedgerProperties()}.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /** Credit limit given to every newly registered customer. */
    @NotNull
    @DecimalMin("0.00")
    private BigDecimal defaultCreditLimit = new BigDecimal("2000.00");

    /** Hard ceiling for any customer's credit limit. */
    @NotNull
    private BigDecimal maxCreditLimit = new BigDecimal("50000.00");

    /** Limit increases up to this value are approved without an admin. */
    @NotNull
    private BigDecimal autoApproveLimit = new BigDecimal("5000.00");

    /**
     * Platform commission, locked into each transaction when it is created. At most four
     * decimals, the precision of the {@code commission_rate} columns.
     */
    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    @Digits(integer = 1, fraction = 4)
    private BigDecimal commissionRate = new BigDecimal("0.005");

    @NotNull
    private Duration requestExpiry = Duration.ofHours(24);

    /** Days after acceptance until a pay-in-full (single installment) plan is due. */
    @Min(0)
    private int payInFullGraceDays = 10;

    @Min(1)
    private int upcomingWindowDays = 30;

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Sweeper sweeper = new Sweeper();

    @Getter
    @Setter
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(50);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofMillis(500);
    }

    @Getter
    @Setter
    public static class Sweeper {
        private boolean enabled = false;
        private String cron = "0 */15 * * * *";
    }
}
