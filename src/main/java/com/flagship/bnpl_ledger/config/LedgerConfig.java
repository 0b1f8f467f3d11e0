package com.flagship.bnpl_ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

/**
 * Core beans: the clock every "now" is read from and the retry policy for row conflicts.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retries only lock-acquisition failures, deadlocks and optimistic version conflicts.
     * Business rule failures propagate on the first attempt.
     */
    @Bean
    public RetryTemplate ledgerRetryTemplate(LedgerProperties properties) {
        LedgerProperties.Retry retry = properties.getRetry();
        return RetryTemplate.builder()
                .maxAttempts(retry.getMaxAttempts())
                .exponentialBackoff(retry.getInitialBackoff().toMillis(), retry.getMultiplier(),
                        retry.getMaxBackoff().toMillis())
                .retryOn(ConcurrencyFailureException.class)
                .traversingCauses()
                .build();
    }
}
