package com.pagesentry.analyze.evidence;

import com.pagesentry.analyze.dlq.DeadLetterQueue;
import com.pagesentry.analyze.dlq.DeadLetterSweeper;
import com.pagesentry.analyze.model.ScreenshotJob;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.config.AnalyzerProperties;
import com.pagesentry.config.RuntimeSizing;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the background evidence workers: one hit flusher, the screenshot pool and the dead letter
 * sweeper. Started once at startup; on shutdown the screenshot pool stops, unprocessed screenshot
 * jobs are dead-lettered and the hit queue is flushed one last time.
 */
@Service
public class EvidencePipeline {
    private static final Logger log = LoggerFactory.getLogger(EvidencePipeline.class);
    private static final long STOP_WAIT_SECONDS = 10;

    private final HitFlushWorker flushWorker;
    private final ScreenshotWorkerPool screenshotWorkers;
    private final DeadLetterSweeper sweeper;
    private final EvidenceQueues queues;
    private final DeadLetterQueue deadLetters;
    private final AnalyzerProperties properties;
    private final RuntimeSizing sizing;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService flushExecutor;
    private ExecutorService screenshotExecutor;
    private ScheduledExecutorService sweepExecutor;

    public EvidencePipeline(
        HitFlushWorker flushWorker,
        ScreenshotWorkerPool screenshotWorkers,
        DeadLetterSweeper sweeper,
        EvidenceQueues queues,
        DeadLetterQueue deadLetters,
        AnalyzerProperties properties,
        RuntimeSizing sizing
    ) {
        this.flushWorker = flushWorker;
        this.screenshotWorkers = screenshotWorkers;
        this.sweeper = sweeper;
        this.queues = queues;
        this.deadLetters = deadLetters;
        this.properties = properties;
        this.sizing = sizing;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getEvidence().isWorkersEnabled()) {
            start();
        } else {
            log.info("Evidence workers disabled");
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            running.set(true);
            int workers = sizing.screenshotWorkers();
            flushExecutor = Executors.newSingleThreadExecutor(daemon("hit-flusher"));
            flushExecutor.submit(() -> flushWorker.run(running::get));

            screenshotExecutor = Executors.newFixedThreadPool(workers, daemon("screenshot-worker"));
            for (int i = 0; i < workers; i++) {
                int workerIndex = i + 1;
                screenshotExecutor.submit(() -> screenshotWorkers.workerLoop(workerIndex));
            }

            long sweepSeconds = properties.getDlq().getSweepIntervalSeconds();
            sweepExecutor = Executors.newSingleThreadScheduledExecutor(daemon("dlq-sweeper"));
            sweepExecutor.scheduleWithFixedDelay(sweeper::sweepOnce, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);
            log.info("Evidence pipeline started: {} screenshot workers, dlq sweep every {}s", workers, sweepSeconds);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            shutdown(sweepExecutor, "dlq-sweeper");
            shutdown(screenshotExecutor, "screenshot-worker");
            stopFlusher();
            sweepExecutor = null;
            screenshotExecutor = null;
            flushExecutor = null;

            List<ScreenshotJob> pending = new ArrayList<>();
            queues.drainScreenshots(pending);
            for (ScreenshotJob job : pending) {
                deadLetters.pushScreenshot(job, FailureReasons.SHUTDOWN);
            }
            int flushed = flushWorker.drain();
            log.info("Evidence pipeline stopped: flushed {} hits, dead-lettered {} screenshot jobs", flushed, pending.size());
        }
    }

    /**
     * The flusher sees {@code running} go false and exits after its current batch; it is only
     * interrupted when that takes longer than the stop wait.
     */
    private void stopFlusher() {
        if (flushExecutor == null) {
            return;
        }
        flushExecutor.shutdown();
        try {
            if (!flushExecutor.awaitTermination(STOP_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("hit-flusher still busy after {}s, interrupting", STOP_WAIT_SECONDS);
                shutdown(flushExecutor, "hit-flusher");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flushExecutor.shutdownNow();
        }
    }

    private static void shutdown(ExecutorService executor, String name) {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(STOP_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("{} did not stop within {}s", name, STOP_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
