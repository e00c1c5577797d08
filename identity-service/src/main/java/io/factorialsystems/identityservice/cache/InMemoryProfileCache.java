package io.factorialsystems.identityservice.cache;

import io.factorialsystems.identityservice.exception.CacheFailureException;
import io.factorialsystems.identityservice.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local fallback used when Redis is unavailable at start-up.
 * <p>
 * Every put schedules its own removal after the TTL. The removal only deletes the key if it
 * still holds the entry that scheduled it, so a later put of the same key keeps its full TTL.
 * Reads also check the entry age against the clock, so an entry is never served past its TTL
 * even if the scheduler runs late. Entries do not survive a restart and are not shared with
 * other instances.
 */
@Slf4j
public class InMemoryProfileCache implements ProfileCache {

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;
    private final TaskScheduler scheduler;

    public InMemoryProfileCache(Duration ttl, Clock clock, TaskScheduler scheduler) {
        this.ttl = ttl;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    @Override
    public Optional<UserIdentity> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant(), ttl)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, UserIdentity value) {
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(key, value, now);
        entries.put(key, entry);
        try {
            scheduler.schedule(() -> expire(entry), now.plus(ttl));
        } catch (TaskRejectedException e) {
            // an entry without a scheduled removal would never leave the map
            entries.remove(key, entry);
            throw new CacheFailureException("Could not schedule expiry for " + key, e);
        }
    }

    @Override
    public void evict(String key) {
        entries.remove(key);
    }

    @Override
    public CacheMode mode() {
        return CacheMode.DEGRADED;
    }

    int size() {
        return entries.size();
    }

    private void expire(CacheEntry entry) {
        if (entries.remove(entry.key(), entry)) {
            log.debug("Expired in-memory profile: {}", entry.key());
        }
    }
}
