package com.flagship.bnpl_ledger.reference;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Human-readable references printed on receipts and statements,
 * e.g. {@code TXN-20240315093012-4F0A9C}.
 *
 * Uniqueness is enforced by the database; the random suffix only makes collisions unlikely.
 */
@Component
public class ReferenceGenerator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    // No 0/O, 1/I/L: codes are read out over the phone.
    private static final char[] CODE_ALPHABET = "ABCDEFGHJKMNPQRSTUVWXYZ23456789".toCharArray();
    private static final int CUSTOMER_CODE_LENGTH = 8;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public ReferenceGenerator(Clock clock) {
        this.clock = clock;
    }

    public String purchaseRequest() {
        return next("PR");
    }

    public String transaction() {
        return next("TXN");
    }

    public String plan() {
        return next("PLAN");
    }

    public String payment() {
        return next("PAY");
    }

    public String settlement() {
        return next("STL");
    }

    public String customerCode() {
        StringBuilder code = new StringBuilder(CUSTOMER_CODE_LENGTH);
        for (int i = 0; i < CUSTOMER_CODE_LENGTH; i++) {
            code.append(CODE_ALPHABET[random.nextInt(CODE_ALPHABET.length)]);
        }
        return code.toString();
    }

    private String next(String prefix) {
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(HEX[random.nextInt(HEX.length)]);
        }
        return prefix + "-" + TIMESTAMP.format(clock.instant()) + "-" + suffix;
    }
}
