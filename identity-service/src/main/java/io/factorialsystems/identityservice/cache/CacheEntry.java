package io.factorialsystems.identityservice.cache;

import io.factorialsystems.identityservice.model.UserIdentity;

import java.time.Duration;
import java.time.Instant;

record CacheEntry(String key, UserIdentity value, Instant insertedAt) {

    boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(insertedAt.plus(ttl));
    }
}
