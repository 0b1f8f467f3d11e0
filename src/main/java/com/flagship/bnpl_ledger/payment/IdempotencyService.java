package com.flagship.bnpl_ledger.payment;

import com.flagship.bnpl_ledger.exception.LedgerValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps payment idempotency keys to the payment they created.
 *
 * Redis is a fast path only. The unique {@code payments.idempotency_key} column is the source of
 * truth, so a missing or failing Redis degrades to a database lookup and never to a double apply.
 * Keys are cached only after the payment's transaction commits.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "bnpl:payment-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final int MAX_KEY_LENGTH = 255;

    private final PaymentRepository paymentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the id of the payment created under {@code idempotencyKey}, if any
     */
    public Optional<UUID> lookup(String idempotencyKey) {
        validate(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = findInDatabase(idempotencyKey);
        stored.ifPresent(paymentId -> cache(idempotencyKey, paymentId));
        return stored;
    }

    /**
     * Database-only lookup, used again once the transaction row is locked.
     */
    public Optional<UUID> findInDatabase(String idempotencyKey) {
        return paymentRepository.findByIdempotencyKey(idempotencyKey).map(PaymentEntity::getId);
    }

    /**
     * Caches the mapping once the surrounding transaction has committed.
     */
    public void rememberAfterCommit(String idempotencyKey, UUID paymentId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cache(idempotencyKey, paymentId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(idempotencyKey, paymentId);
            }
        });
    }

    private void cache(String idempotencyKey, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, paymentId.toString(), REDIS_TTL);
            log.debug("Cached idempotency key {} -> {}", idempotencyKey, paymentId);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private void validate(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new LedgerValidationException("Idempotency key cannot be blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new LedgerValidationException("Idempotency key must be at most " + MAX_KEY_LENGTH + " characters");
        }
    }
}
