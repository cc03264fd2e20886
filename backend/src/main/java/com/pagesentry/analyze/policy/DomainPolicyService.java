package com.pagesentry.analyze.policy;

import com.pagesentry.analyze.model.DomainStat;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.util.UrlUtils;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Learns which domains need a full browser render. Per-domain counters live in {@code domain_stats};
 * the force-render set is {@code render_domains} plus the configured forced domains, read through a
 * short-lived in-memory view.
 */
@Service
public class DomainPolicyService {
    private static final Logger log = LoggerFactory.getLogger(DomainPolicyService.class);
    private static final Duration VIEW_TTL = Duration.ofSeconds(30);
    public static final String ORIGIN_LEARNED = "learned";
    public static final String ORIGIN_MANUAL = "manual";

    private final AnalyzerJdbcRepository repository;
    private final Set<String> configuredDomains;
    private final int successThreshold;
    private final Object viewLock = new Object();

    private volatile Set<String> persistedView = Set.of();
    private volatile Instant viewLoadedAt = Instant.EPOCH;

    public DomainPolicyService(AnalyzerJdbcRepository repository, AnalyzerProperties properties) {
        this.repository = repository;
        this.successThreshold = properties.getEscalation().getSuccessThreshold();
        Set<String> configured = new LinkedHashSet<>();
        for (String domain : properties.getEscalation().getForcedDomains()) {
            if (domain != null && !domain.isBlank()) {
                configured.add(domain.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.configuredDomains = Set.copyOf(configured);
    }

    /**
     * True when the page's host contains any force-render domain.
     */
    public boolean isForced(String url) {
        String domain = UrlUtils.domainOf(url);
        if (domain == null) {
            return false;
        }
        for (String forced : configuredDomains) {
            if (domain.contains(forced)) {
                return true;
            }
        }
        for (String forced : persistedDomains()) {
            if (domain.contains(forced)) {
                return true;
            }
        }
        return false;
    }

    public DomainStat recordSeen(String url) {
        String domain = UrlUtils.domainOf(url);
        if (domain == null) {
            return null;
        }
        try {
            return repository.incrementDomainSeen(domain);
        } catch (DataAccessException e) {
            log.warn("Failed to count page for domain={}: {}", domain, e.getMessage());
            return null;
        }
    }

    /**
     * Counts an opportunistic render that produced results. Returns true when this call pushed the
     * domain over the threshold into the force-render set.
     */
    public boolean recordRenderSuccess(String url) {
        String domain = UrlUtils.domainOf(url);
        if (domain == null) {
            return false;
        }
        try {
            DomainStat stat = repository.incrementRenderSuccess(domain);
            if (stat.renderSuccess() >= successThreshold && !persistedDomains().contains(domain)) {
                boolean added = addForcedDomain(domain, ORIGIN_LEARNED);
                if (added) {
                    log.info("Escalated domain={} to force-render after {} successful renders", domain, stat.renderSuccess());
                }
                return added;
            }
            return false;
        } catch (DataAccessException e) {
            log.warn("Failed to record render success for domain={}: {}", domain, e.getMessage());
            return false;
        }
    }

    public boolean addForcedDomain(String domain, String origin) {
        String normalized = UrlUtils.domainOf(domain);
        if (normalized == null) {
            throw new IllegalArgumentException("Not a domain: " + domain);
        }
        boolean added = repository.addRenderDomain(normalized, origin);
        synchronized (viewLock) {
            Set<String> updated = new LinkedHashSet<>(persistedView);
            updated.add(normalized);
            persistedView = Set.copyOf(updated);
        }
        return added;
    }

    public Set<String> forcedDomains() {
        Set<String> out = new LinkedHashSet<>(configuredDomains);
        out.addAll(persistedDomains());
        return out;
    }

    public List<DomainStat> escalatedDomainStats() {
        return repository.findEscalatedDomainStats();
    }

    public DomainStat stat(String domain) {
        return repository.findDomainStat(domain);
    }

    private Set<String> persistedDomains() {
        if (Instant.now().isBefore(viewLoadedAt.plus(VIEW_TTL))) {
            return persistedView;
        }
        synchronized (viewLock) {
            if (Instant.now().isBefore(viewLoadedAt.plus(VIEW_TTL))) {
                return persistedView;
            }
            try {
                persistedView = Set.copyOf(repository.findRenderDomains());
            } catch (DataAccessException e) {
                log.warn("Failed to refresh force-render domains, keeping previous view: {}", e.getMessage());
            }
            viewLoadedAt = Instant.now();
            return persistedView;
        }
    }
}
