package io.factorialsystems.identityservice.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.factorialsystems.identityservice.exception.CacheFailureException;
import io.factorialsystems.identityservice.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Profiles stored as JSON in Redis. Expiry is enforced by the Redis server.
 */
@Slf4j
public class RedisProfileCache implements ProfileCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisProfileCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public Optional<UserIdentity> get(String key) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(key);
        } catch (DataAccessException e) {
            throw new CacheFailureException("Redis get failed for " + key, e);
        }

        if (json == null) {
            log.debug("Cache miss for profile: {}", key);
            return Optional.empty();
        }

        try {
            log.debug("Cache hit for profile: {}", key);
            return Optional.of(objectMapper.readValue(json, UserIdentity.class));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize cached profile: {}", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, UserIdentity value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheFailureException("Failed to serialize profile " + key, e);
        }

        try {
            redisTemplate.opsForValue().set(key, json, ttl);
            log.debug("Cached profile: {} with TTL: {}", key, ttl);
        } catch (DataAccessException e) {
            throw new CacheFailureException("Redis set failed for " + key, e);
        }
    }

    @Override
    public void evict(String key) {
        try {
            redisTemplate.delete(key);
            log.debug("Evicted profile cache: {}", key);
        } catch (DataAccessException e) {
            throw new CacheFailureException("Redis delete failed for " + key, e);
        }
    }

    @Override
    public CacheMode mode() {
        return CacheMode.SHARED;
    }
}
