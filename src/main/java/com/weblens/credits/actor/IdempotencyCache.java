package com.weblens.credits.actor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.weblens.credits.config.CreditProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived memory of completed deposits and debits, keyed by wallet and
 * caller-supplied id. Only consulted from inside a wallet's actor, so a lookup
 * followed by a record for the same wallet cannot interleave with another
 * operation on that wallet.
 */
@Component
public class IdempotencyCache {

    private final boolean enabled;
    private final Cache<String, Object> completed;

    @Autowired
    public IdempotencyCache(CreditProperties properties) {
        this(properties.getIdempotency().isEnabled(),
             properties.getIdempotency().getTtl(),
             properties.getIdempotency().getMaximumSize());
    }

    public IdempotencyCache(boolean enabled, Duration ttl, long maximumSize) {
        this.enabled = enabled;
        this.completed = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
    }

    public static IdempotencyCache disabled() {
        return new IdempotencyCache(false, Duration.ofSeconds(1), 1);
    }

    public <T> Optional<T> find(String walletKey, String operation, String id, Class<T> type) {
        if (!enabled) return Optional.empty();
        Object hit = completed.getIfPresent(key(walletKey, operation, id));
        return type.isInstance(hit) ? Optional.of(type.cast(hit)) : Optional.empty();
    }

    public void record(String walletKey, String operation, String id, Object result) {
        if (enabled) {
            completed.put(key(walletKey, operation, id), result);
        }
    }

    private static String key(String walletKey, String operation, String id) {
        return walletKey + '|' + operation + '|' + id;
    }
}
