package com.flagship.general_ledger.journal;

import com.flagship.general_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps Idempotency-Key headers to journal entries already created for them.
 *
 * Redis is the fast path and may be unavailable; the unique
 * journal_entries.idempotency_key column is the source of truth.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final int MAX_KEY_LENGTH = 255;

    private final JournalEntryRepository entryRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(JournalEntryRepository entryRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.entryRepository = entryRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the ID of the entry created earlier with this key, if any
     */
    public Optional<UUID> findEntryForKey(String idempotencyKey) {
        validateKey(idempotencyKey);

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

        Optional<UUID> entryId = entryRepository.findIdByIdempotencyKey(idempotencyKey);
        entryId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return entryId;
    }

    /**
     * Caches the mapping after the entry row (which holds the key) has been written.
     */
    public void remember(String idempotencyKey, UUID entryId) {
        validateKey(idempotencyKey);
        cache(idempotencyKey, entryId);
    }

    private void cache(String idempotencyKey, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, entryId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void validateKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key cannot be blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new ValidationException("Idempotency key must be at most " + MAX_KEY_LENGTH + " characters");
        }
    }
}
