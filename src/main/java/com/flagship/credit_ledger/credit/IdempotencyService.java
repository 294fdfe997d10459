package com.flagship.credit_ledger.credit;

import com.flagship.credit_ledger.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps issuance idempotency keys to credit ids.
 *
 * Redis is the fast path; the unique credits.idempotency_key column is the source of truth
 * and is consulted whenever Redis misses or is unavailable.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "credit-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LedgerStore ledgerStore;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(LedgerStore ledgerStore, Optional<StringRedisTemplate> redisTemplate) {
        this.ledgerStore = ledgerStore;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the id of the credit issued under this key, if any
     */
    public Optional<UUID> findCreditId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String creditId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (creditId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(creditId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> creditId = ledgerStore.findByIdempotencyKey(idempotencyKey).map(Credit::getId);
        creditId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return creditId;
    }

    /**
     * Caches a key after the credit carrying it has committed. The database row already
     * holds the key, so a failure here only costs a slower lookup later.
     */
    public void remember(String idempotencyKey, UUID creditId) {
        requireKey(idempotencyKey);
        if (creditId == null) {
            throw new IllegalArgumentException("Credit ID cannot be null");
        }
        cache(idempotencyKey, creditId);
    }

    private void cache(String idempotencyKey, UUID creditId) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, creditId.toString(), REDIS_TTL);
            } catch (Exception e) {
                log.debug("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
            }
        });
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
