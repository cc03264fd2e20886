package com.pagesentry.analyze.evidence;

import com.pagesentry.analyze.dlq.DeadLetterQueue;
import com.pagesentry.analyze.model.ScreenshotJob;
import com.pagesentry.analyze.model.ValidatedHit;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hot-path entry into evidence persistence. Deduplicates (sub_url, keyword) per main_url bucket and
 * hands hits and screenshot jobs to their queues without blocking; a full queue routes the item to
 * the dead letter queue.
 */
@Component
public class HitRecorder {
    private static final Logger log = LoggerFactory.getLogger(HitRecorder.class);

    public enum Outcome {
        QUEUED,
        DUPLICATE,
        DEAD_LETTERED
    }

    private final EvidenceQueues queues;
    private final DeadLetterQueue deadLetters;
    private final AnalyzerMetrics metrics;
    private final double screenshotConfidence;
    private final boolean screenshotsEnabled;
    private final Map<String, Set<String>> buckets = new ConcurrentHashMap<>();

    public HitRecorder(
        EvidenceQueues queues,
        DeadLetterQueue deadLetters,
        AnalyzerMetrics metrics,
        AnalyzerProperties properties
    ) {
        this.queues = queues;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.screenshotConfidence = properties.getEvidence().getScreenshotConfidence();
        this.screenshotsEnabled = properties.getRender().isEnabled();
    }

    public Outcome record(ValidatedHit hit) {
        if (!claim(hit)) {
            return Outcome.DUPLICATE;
        }
        if (screenshotsEnabled && hit.confidence() >= screenshotConfidence) {
            ScreenshotJob job = hit.toScreenshotJob();
            if (!queues.offerScreenshot(job)) {
                metrics.queueOverflow();
                log.warn("Screenshot queue full, dead-lettering job url={} keyword={}", hit.subUrl(), hit.keyword());
                deadLetters.pushScreenshot(job, FailureReasons.SCREENSHOT_QUEUE_FULL);
            }
        }
        if (!queues.offerHit(hit)) {
            metrics.queueOverflow();
            log.warn("Hit queue full, dead-lettering hit url={} keyword={}", hit.subUrl(), hit.keyword());
            deadLetters.pushHit(hit, FailureReasons.HIT_QUEUE_FULL);
            return Outcome.DEAD_LETTERED;
        }
        return Outcome.QUEUED;
    }

    /**
     * Drops the dedupe bucket for a finished or restarted task.
     */
    public void forget(String mainUrl) {
        if (mainUrl != null) {
            buckets.remove(mainUrl);
        }
    }

    int bucketCount() {
        return buckets.size();
    }

    private boolean claim(ValidatedHit hit) {
        String bucketKey = hit.mainUrl() == null ? hit.subUrl() : hit.mainUrl();
        Set<String> bucket = buckets.computeIfAbsent(bucketKey, ignored -> new HashSet<>());
        synchronized (bucket) {
            return bucket.add(hit.subUrl() + "\u0000" + hit.keyword());
        }
    }
}
