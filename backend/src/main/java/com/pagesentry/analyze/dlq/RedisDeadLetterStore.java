package com.pagesentry.analyze.dlq;

import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Redis lists under {@code dlq:<kind>}: LPUSH to add, RPOP to take the oldest. Every push refreshes
 * the key TTL.
 */
@Component
@ConditionalOnProperty(prefix = "analyzer.dlq", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisDeadLetterStore implements DeadLetterStore {
    private static final Logger log = LoggerFactory.getLogger(RedisDeadLetterStore.class);
    static final String KEY_PREFIX = "dlq:";

    private final StringRedisTemplate redis;
    private final Duration ttl;

    public RedisDeadLetterStore(StringRedisTemplate redis, AnalyzerProperties properties) {
        this.redis = redis;
        this.ttl = Duration.ofDays(properties.getDlq().getTtlDays());
    }

    @Override
    public boolean push(String kind, String payload) {
        String key = KEY_PREFIX + kind;
        try {
            redis.opsForList().leftPush(key, payload);
            redis.expire(key, ttl);
            return true;
        } catch (DataAccessException e) {
            log.error("Dead letter store unavailable, cannot push to {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public String pop(String kind) {
        try {
            return redis.opsForList().rightPop(KEY_PREFIX + kind);
        } catch (DataAccessException e) {
            log.warn("Dead letter store unavailable, cannot pop {}: {}", kind, e.getMessage());
            return null;
        }
    }

    @Override
    public long size(String kind) {
        try {
            Long size = redis.opsForList().size(KEY_PREFIX + kind);
            return size == null ? 0L : size;
        } catch (DataAccessException e) {
            log.warn("Dead letter store unavailable, cannot size {}: {}", kind, e.getMessage());
            return -1L;
        }
    }
}
