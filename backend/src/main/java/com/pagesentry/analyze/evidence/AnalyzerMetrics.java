package com.pagesentry.analyze.evidence;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class AnalyzerMetrics {
    private final MeterRegistry registry;
    private final Counter hitsDropped;
    private final Counter screenshotsDropped;
    private final Counter queueOverflow;
    private final Counter screenshotFailures;
    private final Counter rendererFailures;
    private final Counter dbTimeouts;
    private final Counter storageErrors;
    private final Counter hitsPersisted;
    private final Counter screenshotsPersisted;
    private final Counter dlqExhausted;

    public AnalyzerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.hitsDropped = counter("analyzer.hits.dropped", "Hits routed to the dead letter queue");
        this.screenshotsDropped = counter("analyzer.screenshots.dropped", "Screenshot jobs routed to the dead letter queue");
        this.queueOverflow = counter("analyzer.queue.overflow", "Non-blocking enqueue attempts rejected by a full queue");
        this.screenshotFailures = counter("analyzer.screenshot.failures", "Screenshot jobs that exhausted stage retries");
        this.rendererFailures = counter("analyzer.renderer.failures", "Failed or timed out render service calls");
        this.dbTimeouts = counter("analyzer.db.timeouts", "Hit flushes that exceeded their timeout");
        this.storageErrors = counter("analyzer.storage.errors", "Failed object store uploads");
        this.hitsPersisted = counter("analyzer.hits.persisted", "Hits written to the relational store");
        this.screenshotsPersisted = counter("analyzer.screenshots.persisted", "Screenshots attached to hits");
        this.dlqExhausted = counter("analyzer.dlq.exhausted", "Dead letters dropped after exhausting retries");
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    public void registerQueueGauge(String queueName, Collection<?> queue) {
        Gauge.builder("analyzer.queue.depth", queue, Collection::size)
            .tag("queue", queueName)
            .description("Items waiting in an evidence queue")
            .register(registry);
    }

    public void hitDropped() {
        hitsDropped.increment();
    }

    public void screenshotDropped() {
        screenshotsDropped.increment();
    }

    public void queueOverflow() {
        queueOverflow.increment();
    }

    public void screenshotFailure() {
        screenshotFailures.increment();
    }

    public void rendererFailure() {
        rendererFailures.increment();
    }

    public void dbTimeout() {
        dbTimeouts.increment();
    }

    public void storageError() {
        storageErrors.increment();
    }

    public void hitsPersisted(int count) {
        hitsPersisted.increment(count);
    }

    public void screenshotPersisted() {
        screenshotsPersisted.increment();
    }

    public void dlqExhausted() {
        dlqExhausted.increment();
    }

    public Map<String, Double> snapshot() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("hits_dropped", hitsDropped.count());
        out.put("screenshots_dropped", screenshotsDropped.count());
        out.put("queue_overflow_count", queueOverflow.count());
        out.put("screenshot_failures", screenshotFailures.count());
        out.put("renderer_failures", rendererFailures.count());
        out.put("db_timeouts", dbTimeouts.count());
        out.put("storage_errors", storageErrors.count());
        out.put("total_hits_processed", hitsPersisted.count());
        out.put("total_screenshots_processed", screenshotsPersisted.count());
        out.put("dlq_exhausted", dlqExhausted.count());
        return out;
    }
}
