package io.factorialsystems.identityservice.cache;

import io.factorialsystems.identityservice.exception.CacheFailureException;
import io.factorialsystems.identityservice.model.UserIdentity;

import java.util.Optional;

/**
 * Read-through cache of user profiles keyed by {@link #keyFor(long)}. An entry is never served
 * once its TTL has elapsed since it was put.
 * <p>
 * Implementations may throw {@link CacheFailureException}; callers treat it as a miss.
 */
public interface ProfileCache {

    String KEY_PREFIX = "user:";

    static String keyFor(long userId) {
        return KEY_PREFIX + userId;
    }

    Optional<UserIdentity> get(String key);

    void put(String key, UserIdentity value);

    void evict(String key);

    CacheMode mode();
}
