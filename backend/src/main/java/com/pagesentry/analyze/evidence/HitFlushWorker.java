package com.pagesentry.analyze.evidence;

import com.pagesentry.analyze.dlq.DeadLetterQueue;
import com.pagesentry.analyze.model.ValidatedHit;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Drains the hit queue in batches of up to {@code flushBatchSize} or every {@code flushIntervalMs},
 * whichever comes first, and bulk-inserts each batch on the db pool under a hard timeout. A batch
 * that times out or fails goes to the dead letter queue whole.
 */
@Component
public class HitFlushWorker {
    private static final Logger log = LoggerFactory.getLogger(HitFlushWorker.class);

    private final EvidenceQueues queues;
    private final AnalyzerJdbcRepository repository;
    private final DeadLetterQueue deadLetters;
    private final AnalyzerMetrics metrics;
    private final ExecutorService dbExecutor;
    private final int batchSize;
    private final long intervalMs;
    private final long timeoutMs;

    public HitFlushWorker(
        EvidenceQueues queues,
        AnalyzerJdbcRepository repository,
        DeadLetterQueue deadLetters,
        AnalyzerMetrics metrics,
        @Qualifier("dbExecutor") ExecutorService dbExecutor,
        AnalyzerProperties properties
    ) {
        this.queues = queues;
        this.repository = repository;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.dbExecutor = dbExecutor;
        AnalyzerProperties.Evidence evidence = properties.getEvidence();
        this.batchSize = evidence.getFlushBatchSize();
        this.intervalMs = evidence.getFlushIntervalMs();
        this.timeoutMs = TimeUnit.SECONDS.toMillis(evidence.getFlushTimeoutSeconds());
    }

    /**
     * Worker loop; returns when interrupted.
     */
    public void run() {
        run(() -> true);
    }

    /**
     * Worker loop; returns once {@code keepRunning} turns false or the thread is interrupted. Hits
     * already taken off the queue are flushed before returning.
     */
    public void run(BooleanSupplier keepRunning) {
        while (keepRunning.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
            try {
                List<ValidatedHit> batch = nextBatch();
                if (!batch.isEmpty()) {
                    flushCollected(batch);
                }
            } catch (RuntimeException e) {
                log.warn("Hit flush loop error", e);
            }
        }
    }

    /**
     * Flushes everything currently queued. Used on shutdown.
     */
    public int drain() {
        int flushed = 0;
        List<ValidatedHit> batch = new ArrayList<>(batchSize);
        while (queues.drainHits(batch, batchSize) > 0) {
            flush(batch);
            flushed += batch.size();
            batch = new ArrayList<>(batchSize);
        }
        return flushed;
    }

    List<ValidatedHit> nextBatch() {
        List<ValidatedHit> batch = new ArrayList<>(batchSize);
        long deadline = System.currentTimeMillis() + intervalMs;
        while (batch.size() < batchSize) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            ValidatedHit first;
            try {
                first = queues.pollHit(remaining, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (first == null) {
                break;
            }
            batch.add(first);
            queues.drainHits(batch, batchSize - batch.size());
        }
        return batch;
    }

    /**
     * Inserts {@code batch}; true when it was persisted.
     */
    public boolean flush(List<ValidatedHit> batch) {
        if (batch.isEmpty()) {
            return true;
        }
        CompletableFuture<Integer> insert = CompletableFuture.supplyAsync(() -> repository.insertHits(batch), dbExecutor);
        try {
            insert.get(timeoutMs, TimeUnit.MILLISECONDS);
            metrics.hitsPersisted(batch.size());
            return true;
        } catch (TimeoutException e) {
            insert.cancel(true);
            metrics.dbTimeout();
            log.warn("Hit flush timed out after {}ms, dead-lettering {} hits", timeoutMs, batch.size());
            deadLetterAll(batch, FailureReasons.DB_FLUSH_TIMEOUT);
        } catch (ExecutionException e) {
            log.warn("Hit flush failed, dead-lettering {} hits", batch.size(), e.getCause());
            deadLetterAll(batch, FailureReasons.DB_FLUSH_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Hit flush interrupted, dead-lettering {} hits", batch.size());
            deadLetterAll(batch, FailureReasons.DB_FLUSH_ERROR);
        }
        return false;
    }

    private void flushCollected(List<ValidatedHit> batch) {
        // the insert wait must not see a pending interrupt, the batch is already off the queue
        boolean interrupted = Thread.interrupted();
        try {
            if (interrupted) {
                log.info("Hit flusher interrupted, flushing {} collected hits before exit", batch.size());
            }
            flush(batch);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void deadLetterAll(List<ValidatedHit> batch, String error) {
        for (ValidatedHit hit : batch) {
            deadLetters.pushHit(hit, error);
        }
    }
}
