package com.flagship.live_event_ledger.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps a sender's tip idempotency keys to tip IDs. Keys are chosen by
 * clients, so they are scoped to the sender.
 *
 * Redis is a cache in front of the unique (sender, key) pair on event_tips: lookups
 * try Redis first and fall back to the database, and Redis failures are
 * logged and ignored. The database stays the source of truth, so a cached
 * ID whose tip never committed is treated as a miss.
 */
@Service
@Slf4j
public class TipIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "tip-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final EventTipRepository tipRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public TipIdempotencyService(EventTipRepository tipRepository, Optional<StringRedisTemplate> redisTemplate) {
        this.tipRepository = tipRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the tip previously recorded under this key, if any
     */
    public Optional<EventTip> findExistingTip(UUID fromUserId, String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cachedId = readCache(fromUserId, idempotencyKey);
        if (cachedId.isPresent()) {
            Optional<EventTip> cached = tipRepository.findById(cachedId.get())
                .map(EventTipEntity::toDomain)
                .filter(tip -> tip.getFromUserId().equals(fromUserId));
            if (cached.isPresent()) {
                log.debug("Tip idempotency key found in Redis: {}", idempotencyKey);
                return cached;
            }
            log.warn("Tip idempotency key {} cached for missing tip {}, checking database", idempotencyKey, cachedId.get());
        }

        Optional<EventTip> stored = tipRepository.findByFromUserIdAndIdempotencyKey(fromUserId, idempotencyKey)
            .map(EventTipEntity::toDomain);
        stored.ifPresent(tip -> {
            log.debug("Tip idempotency key found in database: {}", idempotencyKey);
            writeCache(fromUserId, idempotencyKey, tip.getId());
        });
        return stored;
    }

    public void remember(UUID fromUserId, String idempotencyKey, UUID tipId) {
        requireKey(idempotencyKey);
        if (tipId == null) {
            throw new IllegalArgumentException("Tip ID cannot be null");
        }
        writeCache(fromUserId, idempotencyKey, tipId);
    }

    private Optional<UUID> readCache(UUID fromUserId, String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(redisKey(fromUserId, idempotencyKey));
            return value != null ? Optional.of(UUID.fromString(value)) : Optional.empty();
        } catch (Exception e) {
            log.warn("Redis lookup failed for tip idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(UUID fromUserId, String idempotencyKey, UUID tipId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey(fromUserId, idempotencyKey), tipId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache tip idempotency key {}: {}", idempotencyKey, e.getMessage());
        }
    }

    static String redisKey(UUID fromUserId, String idempotencyKey) {
        return REDIS_KEY_PREFIX + fromUserId + ":" + idempotencyKey;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
