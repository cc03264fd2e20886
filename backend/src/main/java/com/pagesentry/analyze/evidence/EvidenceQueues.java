package com.pagesentry.analyze.evidence;

import com.pagesentry.analyze.model.ScreenshotJob;
import com.pagesentry.analyze.model.ValidatedHit;
import com.pagesentry.config.RuntimeSizing;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * The two bounded evidence queues. Hot-path enqueues never block.
 */
@Component
public class EvidenceQueues {
    private final BlockingQueue<ValidatedHit> hits;
    private final BlockingQueue<ScreenshotJob> screenshots;

    @Autowired
    public EvidenceQueues(RuntimeSizing sizing, AnalyzerMetrics metrics) {
        this(sizing.hitQueueCapacity(), sizing.screenshotQueueCapacity());
        metrics.registerQueueGauge("hits", hits);
        metrics.registerQueueGauge("screenshots", screenshots);
    }

    EvidenceQueues(int hitCapacity, int screenshotCapacity) {
        this.hits = new ArrayBlockingQueue<>(Math.max(1, hitCapacity));
        this.screenshots = new ArrayBlockingQueue<>(Math.max(1, screenshotCapacity));
    }

    public boolean offerHit(ValidatedHit hit) {
        return hits.offer(hit);
    }

    public boolean offerScreenshot(ScreenshotJob job) {
        return screenshots.offer(job);
    }

    public ValidatedHit pollHit(long timeout, TimeUnit unit) throws InterruptedException {
        return hits.poll(timeout, unit);
    }

    public int drainHits(List<ValidatedHit> target, int max) {
        return hits.drainTo(target, max);
    }

    public ScreenshotJob pollScreenshot(long timeout, TimeUnit unit) throws InterruptedException {
        return screenshots.poll(timeout, unit);
    }

    public int drainScreenshots(List<ScreenshotJob> target) {
        return screenshots.drainTo(target);
    }

    public int hitDepth() {
        return hits.size();
    }

    public int screenshotDepth() {
        return screenshots.size();
    }
}
