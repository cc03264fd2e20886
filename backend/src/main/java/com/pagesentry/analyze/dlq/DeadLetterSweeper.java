package com.pagesentry.analyze.dlq;

import com.pagesentry.analyze.evidence.AnalyzerMetrics;
import com.pagesentry.analyze.evidence.EvidenceQueues;
import com.pagesentry.analyze.model.FailedHit;
import com.pagesentry.analyze.model.FailedScreenshot;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One sweep takes at most one dead letter of each kind and re-offers it to its live queue.
 * A requeued item carries its attempt number, so a later downstream failure resumes the count.
 * Entries that reached {@code dlq.maxRetries} are dropped and counted.
 */
@Component
public class DeadLetterSweeper {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterSweeper.class);

    public enum Result {
        EMPTY,
        REQUEUED,
        RETURNED,
        DROPPED
    }

    private final DeadLetterQueue deadLetters;
    private final EvidenceQueues queues;
    private final AnalyzerMetrics metrics;
    private final int maxRetries;

    public DeadLetterSweeper(
        DeadLetterQueue deadLetters,
        EvidenceQueues queues,
        AnalyzerMetrics metrics,
        AnalyzerProperties properties
    ) {
        this.deadLetters = deadLetters;
        this.queues = queues;
        this.metrics = metrics;
        this.maxRetries = properties.getDlq().getMaxRetries();
    }

    public void sweepOnce() {
        try {
            sweepHit();
            sweepScreenshot();
            int purged = deadLetters.purgeExpired();
            if (purged > 0) {
                log.info("Purged {} expired dead letters", purged);
            }
        } catch (RuntimeException e) {
            log.warn("Dead letter sweep failed", e);
        }
    }

    public Result sweepHit() {
        FailedHit failed = deadLetters.popHit();
        if (failed == null) {
            return Result.EMPTY;
        }
        if (failed.retryCount() >= maxRetries) {
            metrics.dlqExhausted();
            log.error("Dropping hit after {} retries task={} url={} keyword={} lastError={}",
                failed.retryCount(), failed.hit().taskId(), failed.hit().subUrl(), failed.hit().keyword(), failed.error());
            return Result.DROPPED;
        }
        if (queues.offerHit(failed.hit().withAttempt(failed.retryCount() + 1))) {
            log.info("Requeued dead-lettered hit url={} keyword={} retry={}",
                failed.hit().subUrl(), failed.hit().keyword(), failed.retryCount() + 1);
            return Result.REQUEUED;
        }
        deadLetters.pushHit(failed.retried(FailureReasons.HIT_QUEUE_FULL));
        return Result.RETURNED;
    }

    public Result sweepScreenshot() {
        FailedScreenshot failed = deadLetters.popScreenshot();
        if (failed == null) {
            return Result.EMPTY;
        }
        if (failed.retryCount() >= maxRetries) {
            metrics.dlqExhausted();
            log.error("Dropping screenshot job after {} retries task={} url={} keyword={} lastError={}",
                failed.retryCount(), failed.job().taskId(), failed.job().subUrl(), failed.job().keyword(), failed.error());
            return Result.DROPPED;
        }
        if (queues.offerScreenshot(failed.job().withAttempt(failed.retryCount() + 1))) {
            log.info("Requeued dead-lettered screenshot url={} keyword={} retry={}",
                failed.job().subUrl(), failed.job().keyword(), failed.retryCount() + 1);
            return Result.REQUEUED;
        }
        deadLetters.pushScreenshot(failed.retried(FailureReasons.SCREENSHOT_QUEUE_FULL));
        return Result.RETURNED;
    }
}
