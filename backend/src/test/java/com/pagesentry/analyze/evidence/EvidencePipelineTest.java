package com.pagesentry.analyze.evidence;

import com.pagesentry.analyze.dlq.DeadLetterQueue;
import com.pagesentry.analyze.dlq.DeadLetterSweeper;
import com.pagesentry.analyze.dlq.InMemoryDeadLetterStore;
import com.pagesentry.analyze.http.RenderServiceClient;
import com.pagesentry.analyze.model.FailedScreenshot;
import com.pagesentry.analyze.model.ScreenshotJob;
import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.storage.ObjectStore;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.config.AnalyzerConfig;
import com.pagesentry.config.AnalyzerProperties;
import com.pagesentry.config.RuntimeSizing;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvidencePipelineTest {
    private AnalyzerJdbcRepository repository;
    private RenderServiceClient renderClient;
    private InMemoryDeadLetterStore store;
    private DeadLetterQueue deadLetters;
    private EvidenceQueues queues;
    private ExecutorService dbExecutor;
    private EvidencePipeline pipeline;

    @BeforeEach
    void setUp() {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getSizing().setCores(1);
        properties.getEvidence().setScreenshotWorkers(1);
        properties.getEvidence().setFlushIntervalMs(10);
        properties.getEvidence().setStageMaxAttempts(1);
        properties.getEvidence().setStageBackoffMs(0);

        repository = mock(AnalyzerJdbcRepository.class);
        renderClient = mock(RenderServiceClient.class);
        store = new InMemoryDeadLetterStore();
        AnalyzerMetrics metrics = new AnalyzerMetrics(new SimpleMeterRegistry());
        deadLetters = new DeadLetterQueue(store, new AnalyzerConfig().objectMapper(), metrics);
        queues = new EvidenceQueues(100, 10);
        dbExecutor = Executors.newSingleThreadExecutor();

        pipeline = new EvidencePipeline(
            new HitFlushWorker(queues, repository, deadLetters, metrics, dbExecutor, properties),
            new ScreenshotWorkerPool(
                queues, renderClient, mock(ObjectStore.class), repository, deadLetters, metrics, properties
            ),
            new DeadLetterSweeper(deadLetters, queues, metrics, properties),
            queues,
            deadLetters,
            properties,
            RuntimeSizing.from(properties)
        );
    }

    @AfterEach
    void tearDown() {
        pipeline.stop();
        dbExecutor.shutdownNow();
    }

    @Test
    void flushesQueuedHitsWhileRunning() {
        when(repository.insertHits(anyList())).thenAnswer(invocation -> invocation.<List<?>>getArgument(0).size());
        pipeline.start();
        pipeline.start();

        queues.offerHit(HitRecorderTest.hit("https://a.example", "https://a.example/1", "weed", 0.5));

        verify(repository, timeout(5_000)).insertHits(anyList());
        assertThat(pipeline.isRunning()).isTrue();
    }

    @Test
    void stopDeadLettersScreenshotJobsStillQueued() throws Exception {
        CountDownLatch busy = new CountDownLatch(1);
        when(renderClient.renderAndScreenshot(anyString(), anyString(), anyInt())).thenAnswer(invocation -> {
            busy.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StageResult.failed(FailureReasons.INTERRUPTED, "stopped");
        });
        pipeline.start();

        queues.offerScreenshot(new ScreenshotJob("https://a.example/1", "weed", "https://a.example", "task-1"));
        assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();
        queues.offerScreenshot(new ScreenshotJob("https://a.example/2", "weed", "https://a.example", "task-1"));

        pipeline.stop();

        assertThat(pipeline.isRunning()).isFalse();
        List<String> errors = new ArrayList<>();
        FailedScreenshot failed;
        while ((failed = deadLetters.popScreenshot()) != null) {
            errors.add(failed.job().subUrl() + " " + failed.error());
        }
        assertThat(errors).contains("https://a.example/2 " + FailureReasons.SHUTDOWN);
    }
}
