package com.pagesentry.analyze.dlq;

import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Dead letters kept in the {@code dead_letters} table, for deployments without Redis.
 */
@Component
@ConditionalOnProperty(prefix = "analyzer.dlq", name = "store", havingValue = "jdbc")
public class JdbcDeadLetterStore implements DeadLetterStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcDeadLetterStore.class);

    private final AnalyzerJdbcRepository repository;
    private final Duration ttl;

    public JdbcDeadLetterStore(AnalyzerJdbcRepository repository, AnalyzerProperties properties) {
        this.repository = repository;
        this.ttl = Duration.ofDays(properties.getDlq().getTtlDays());
    }

    @Override
    public boolean push(String kind, String payload) {
        try {
            repository.pushDeadLetter(kind, payload, Instant.now().plus(ttl));
            return true;
        } catch (DataAccessException e) {
            log.error("Dead letter table unavailable, cannot push {}: {}", kind, e.getMessage());
            return false;
        }
    }

    @Override
    public String pop(String kind) {
        try {
            return repository.popOldestDeadLetter(kind);
        } catch (DataAccessException e) {
            log.warn("Dead letter table unavailable, cannot pop {}: {}", kind, e.getMessage());
            return null;
        }
    }

    @Override
    public long size(String kind) {
        try {
            return repository.countDeadLetters(kind);
        } catch (DataAccessException e) {
            log.warn("Dead letter table unavailable, cannot count {}: {}", kind, e.getMessage());
            return -1L;
        }
    }

    @Override
    public int purgeExpired() {
        try {
            return repository.purgeExpiredDeadLetters();
        } catch (DataAccessException e) {
            log.warn("Dead letter table unavailable, cannot purge expired entries: {}", e.getMessage());
            return 0;
        }
    }
}
