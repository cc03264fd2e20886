package com.pagesentry.analyze.evidence;

import com.pagesentry.analyze.dlq.DeadLetterQueue;
import com.pagesentry.analyze.dlq.InMemoryDeadLetterStore;
import com.pagesentry.analyze.model.FailedHit;
import com.pagesentry.analyze.model.ValidatedHit;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.config.AnalyzerConfig;
import com.pagesentry.config.AnalyzerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HitFlushWorkerTest {
    private AnalyzerJdbcRepository repository;
    private InMemoryDeadLetterStore store;
    private DeadLetterQueue deadLetters;
    private AnalyzerMetrics metrics;
    private ExecutorService dbExecutor;
    private EvidenceQueues queues;

    @BeforeEach
    void setUp() {
        repository = mock(AnalyzerJdbcRepository.class);
        store = new InMemoryDeadLetterStore();
        metrics = new AnalyzerMetrics(new SimpleMeterRegistry());
        deadLetters = new DeadLetterQueue(store, new AnalyzerConfig().objectMapper(), metrics);
        dbExecutor = Executors.newSingleThreadExecutor();
        queues = new EvidenceQueues(100, 10);
    }

    @AfterEach
    void tearDown() {
        dbExecutor.shutdownNow();
    }

    @Test
    void timedOutFlushDeadLettersEveryHitWithRetryZero() {
        when(repository.insertHits(anyList())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return 0;
        });
        List<ValidatedHit> batch = List.of(
            HitRecorderTest.hit("https://a.example", "https://a.example/1", "weed", 0.8),
            HitRecorderTest.hit("https://a.example", "https://a.example/2", "weed", 0.8),
            HitRecorderTest.hit("https://a.example", "https://a.example/3", "ganja", 0.8)
        );

        boolean persisted = worker().flush(batch);

        assertThat(persisted).isFalse();
        List<FailedHit> dead = new ArrayList<>();
        FailedHit next;
        while ((next = deadLetters.popHit()) != null) {
            dead.add(next);
        }
        assertThat(dead).hasSize(3);
        assertThat(dead).allSatisfy(failed -> {
            assertThat(failed.error()).isEqualTo("db_flush_timeout");
            assertThat(failed.retryCount()).isZero();
        });
        assertThat(dead).extracting(failed -> failed.hit().subUrl())
            .containsExactly("https://a.example/1", "https://a.example/2", "https://a.example/3");
        assertThat(metrics.snapshot()).containsEntry("db_timeouts", 1.0);
    }

    @Test
    void failedInsertDeadLettersWithFlushError() {
        when(repository.insertHits(anyList())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        boolean persisted = worker().flush(List.of(HitRecorderTest.hit("https://a.example", "https://a.example/1", "weed", 0.8)));

        assertThat(persisted).isFalse();
        assertThat(deadLetters.popHit().error()).isEqualTo("db_flush_error");
    }

    @Test
    void drainFlushesQueuedHitsInBatches() {
        when(repository.insertHits(anyList())).thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
        for (int i = 0; i < 5; i++) {
            queues.offerHit(HitRecorderTest.hit("https://a.example", "https://a.example/" + i, "weed", 0.5));
        }

        int flushed = worker().drain();

        assertThat(flushed).isEqualTo(5);
        assertThat(queues.hitDepth()).isZero();
        assertThat(metrics.snapshot()).containsEntry("total_hits_processed", 5.0);
        verify(repository, times(3)).insertHits(anyList());
    }

    @Test
    void nextBatchStopsAtBatchSize() throws Exception {
        for (int i = 0; i < 3; i++) {
            queues.offerHit(HitRecorderTest.hit("https://a.example", "https://a.example/" + i, "weed", 0.5));
        }

        List<ValidatedHit> batch = worker().nextBatch();

        assertThat(batch).hasSize(2);
        assertThat(queues.hitDepth()).isEqualTo(1);
    }

    @Test
    void interruptWhileCollectingStillFlushesTakenHits() throws Exception {
        when(repository.insertHits(anyList())).thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
        HitFlushWorker worker = worker(100, 5_000);
        Thread flusher = new Thread(worker::run, "hit-flusher-test");
        flusher.start();
        queues.offerHit(HitRecorderTest.hit("https://a.example", "https://a.example/1", "weed", 0.8));
        awaitEmptyHitQueue();

        flusher.interrupt();
        flusher.join(5_000);

        assertThat(flusher.isAlive()).isFalse();
        verify(repository).insertHits(argThat(hits -> hits.size() == 1));
        assertThat(metrics.snapshot()).containsEntry("total_hits_processed", 1.0);
        assertThat(store.size(DeadLetterQueue.HITS)).isZero();
    }

    @Test
    void stopSignalEndsLoopAfterFlushingCurrentBatch() throws Exception {
        when(repository.insertHits(anyList())).thenAnswer(invocation -> ((List<?>) invocation.getArgument(0)).size());
        AtomicBoolean keepRunning = new AtomicBoolean(true);
        HitFlushWorker worker = worker(100, 300);
        Thread flusher = new Thread(() -> worker.run(keepRunning::get), "hit-flusher-test");
        flusher.start();
        queues.offerHit(HitRecorderTest.hit("https://a.example", "https://a.example/1", "weed", 0.8));
        awaitEmptyHitQueue();

        keepRunning.set(false);
        flusher.join(5_000);

        assertThat(flusher.isAlive()).isFalse();
        verify(repository).insertHits(argThat(hits -> hits.size() == 1));
    }

    private void awaitEmptyHitQueue() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (queues.hitDepth() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(queues.hitDepth()).isZero();
    }

    private HitFlushWorker worker() {
        return worker(2, 50);
    }

    private HitFlushWorker worker(int batchSize, int intervalMs) {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getEvidence().setFlushBatchSize(batchSize);
        properties.getEvidence().setFlushIntervalMs(intervalMs);
        properties.getEvidence().setFlushTimeoutSeconds(1);
        return new HitFlushWorker(queues, repository, deadLetters, metrics, dbExecutor, properties);
    }
}
