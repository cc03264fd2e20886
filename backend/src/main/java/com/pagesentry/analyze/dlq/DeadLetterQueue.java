package com.pagesentry.analyze.dlq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagesentry.analyze.evidence.AnalyzerMetrics;
import com.pagesentry.analyze.model.DeadLetterStats;
import com.pagesentry.analyze.model.FailedHit;
import com.pagesentry.analyze.model.FailedScreenshot;
import com.pagesentry.analyze.model.ScreenshotJob;
import com.pagesentry.analyze.model.ValidatedHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Typed facade over the {@link DeadLetterStore}. Every hit or screenshot job handed to it counts as
 * dropped from the live path, whether or not the store accepts it.
 */
@Component
public class DeadLetterQueue {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);
    public static final String HITS = "hits";
    public static final String SCREENSHOTS = "screenshots";

    private final DeadLetterStore store;
    private final ObjectMapper objectMapper;
    private final AnalyzerMetrics metrics;

    public DeadLetterQueue(DeadLetterStore store, ObjectMapper objectMapper, AnalyzerMetrics metrics) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public boolean pushHit(ValidatedHit hit, String error) {
        return pushHit(FailedHit.of(hit, error));
    }

    public boolean pushHit(FailedHit failed) {
        metrics.hitDropped();
        boolean stored = push(HITS, failed);
        if (!stored) {
            log.error("Hit lost, dead letter store rejected it task={} url={} keyword={} error={}",
                failed.hit().taskId(), failed.hit().subUrl(), failed.hit().keyword(), failed.error());
        }
        return stored;
    }

    public boolean pushScreenshot(ScreenshotJob job, String error) {
        return pushScreenshot(FailedScreenshot.of(job, error));
    }

    public boolean pushScreenshot(FailedScreenshot failed) {
        metrics.screenshotDropped();
        boolean stored = push(SCREENSHOTS, failed);
        if (!stored) {
            log.error("Screenshot job lost, dead letter store rejected it task={} url={} keyword={} error={}",
                failed.job().taskId(), failed.job().subUrl(), failed.job().keyword(), failed.error());
        }
        return stored;
    }

    public FailedHit popHit() {
        return pop(HITS, FailedHit.class);
    }

    public FailedScreenshot popScreenshot() {
        return pop(SCREENSHOTS, FailedScreenshot.class);
    }

    public int purgeExpired() {
        return store.purgeExpired();
    }

    public DeadLetterStats stats() {
        long hits = store.size(HITS);
        long screenshots = store.size(SCREENSHOTS);
        return new DeadLetterStats(hits >= 0 && screenshots >= 0, Math.max(0, hits), Math.max(0, screenshots), metrics.snapshot());
    }

    private boolean push(String kind, Object entry) {
        try {
            return store.push(kind, objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.error("Cannot serialise {} dead letter: {}", kind, e.getOriginalMessage());
            return false;
        }
    }

    private <T> T pop(String kind, Class<T> type) {
        String payload = store.pop(kind);
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            log.error("Discarding unreadable {} dead letter: {}", kind, e.getOriginalMessage());
            return null;
        }
    }
}
