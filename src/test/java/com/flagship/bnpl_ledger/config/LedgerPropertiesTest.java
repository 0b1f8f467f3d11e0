package com.flagship.bnpl_ledger.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.validation.FieldError;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class LedgerPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(PropertiesConfig.class);

    @Test
    @DisplayName("A four-decimal commission rate binds")
    void testFourDecimalRateBinds() {
        runner.withPropertyValues("ledger.commission-rate=0.0251").run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals(new BigDecimal("0.0251"), context.getBean(LedgerProperties.class).getCommissionRate());
        });
    }

    @Test
    @DisplayName("A rate the commission_rate columns would round is refused at startup")
    void testFiveDecimalRateIsRefused() {
        runner.withPropertyValues("ledger.commission-rate=0.02505").run(context -> {
            assertNotNull(context.getStartupFailure());
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure());
            BindValidationException validation = assertInstanceOf(BindValidationException.class, cause);
            assertTrue(validation.getValidationErrors().getAllErrors().stream()
                .map(FieldError.class::cast)
                .anyMatch(error -> error.getField().equals("commissionRate")));
        });
    }

    @Test
    void testRateAboveOneIsRefused() {
        runner.withPropertyValues("ledger.commission-rate=1.5").run(context ->
            assertNotNull(context.getStartupFailure()));
    }

    @Test
    void testDefaultsAreValid() {
        runner.run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals(new BigDecimal("0.005"), context.getBean(LedgerProperties.class).getCommissionRate());
        });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(LedgerProperties.class)
    static class PropertiesConfig {
    }
}
