package io.factorialsystems.identityservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.factorialsystems.identityservice.cache.InMemoryProfileCache;
import io.factorialsystems.identityservice.cache.ProfileCache;
import io.factorialsystems.identityservice.cache.RedisProfileCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Picks the profile cache once at start-up: Redis when it answers a PING, otherwise the
 * in-memory fallback for the rest of the process lifetime.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    public ProfileCache profileCache(ObjectProvider<StringRedisTemplate> redisTemplate,
                                     ObjectMapper objectMapper,
                                     IdentityProperties properties,
                                     Clock clock,
                                     TaskScheduler profileCacheScheduler) {
        IdentityProperties.Cache cache = properties.getCache();
        StringRedisTemplate template = redisTemplate.getIfAvailable();

        if (cache.isSharedEnabled() && template != null && isRedisHealthy(template)) {
            log.info("Profile cache using Redis with TTL: {}", cache.getTtl());
            return new RedisProfileCache(template, objectMapper, cache.getTtl());
        }

        log.warn("Redis unavailable, profile cache falling back to in-memory map with TTL: {}", cache.getTtl());
        return new InMemoryProfileCache(cache.getTtl(), clock, profileCacheScheduler);
    }

    @Bean
    public ThreadPoolTaskScheduler profileCacheScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("Identity-CacheExpiry-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    static boolean isRedisHealthy(StringRedisTemplate redisTemplate) {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (Exception e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }
}
