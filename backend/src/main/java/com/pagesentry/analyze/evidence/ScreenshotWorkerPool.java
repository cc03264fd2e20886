package com.pagesentry.analyze.evidence;

import com.pagesentry.analyze.dlq.DeadLetterQueue;
import com.pagesentry.analyze.http.RenderServiceClient;
import com.pagesentry.analyze.model.ScreenshotCapture;
import com.pagesentry.analyze.model.ScreenshotJob;
import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.storage.ObjectStore;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.analyze.util.HashUtils;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Consumes screenshot jobs: capture via the render service, upload, then attach the URL to the
 * newest matching hit row still lacking one. Each stage is retried with linear backoff; a stage
 * that keeps failing sends the job to the dead letter queue tagged with that stage.
 */
@Component
public class ScreenshotWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(ScreenshotWorkerPool.class);
    private static final long POLL_MS = 500;

    private final EvidenceQueues queues;
    private final RenderServiceClient renderClient;
    private final ObjectStore objectStore;
    private final AnalyzerJdbcRepository repository;
    private final DeadLetterQueue deadLetters;
    private final AnalyzerMetrics metrics;
    private final AnalyzerProperties properties;

    public ScreenshotWorkerPool(
        EvidenceQueues queues,
        RenderServiceClient renderClient,
        ObjectStore objectStore,
        AnalyzerJdbcRepository repository,
        DeadLetterQueue deadLetters,
        AnalyzerMetrics metrics,
        AnalyzerProperties properties
    ) {
        this.queues = queues;
        this.renderClient = renderClient;
        this.objectStore = objectStore;
        this.repository = repository;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.properties = properties;
    }

    public void workerLoop(int workerIndex) {
        Thread.currentThread().setName("screenshot-worker-" + workerIndex);
        while (!Thread.currentThread().isInterrupted()) {
            try {
                ScreenshotJob job = queues.pollScreenshot(POLL_MS, TimeUnit.MILLISECONDS);
                if (job != null) {
                    process(job);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.warn("Screenshot worker {} error", workerIndex, e);
            }
        }
    }

    /**
     * Runs all three stages for {@code job}; true when the screenshot ended up attached.
     */
    public boolean process(ScreenshotJob job) {
        int maxMatches = properties.getRender().getMaxMatches();
        StageResult<ScreenshotCapture> capture = withRetries(
            "render", job, () -> renderClient.renderAndScreenshot(job.subUrl(), job.keyword(), maxMatches)
        );
        if (!capture.isOk()) {
            metrics.rendererFailure();
            return fail(job, FailureReasons.RENDER_FAILED, capture);
        }

        String bucket = properties.getStorage().getScreenshotBucket();
        String key = objectKey(job);
        StageResult<String> upload = withRetries(
            "upload", job, () -> objectStore.put(bucket, key, capture.value().image(), capture.value().contentType())
        );
        if (!upload.isOk()) {
            metrics.storageError();
            return fail(job, FailureReasons.UPLOAD_FAILED, upload);
        }

        StageResult<Long> attach = withRetries("attach", job, () -> attach(job, upload.value()));
        if (!attach.isOk()) {
            return fail(job, FailureReasons.ATTACH_FAILED, attach);
        }
        metrics.screenshotPersisted();
        log.debug("Screenshot attached hit={} url={} keyword={}", attach.value(), job.subUrl(), job.keyword());
        return true;
    }

    private StageResult<Long> attach(ScreenshotJob job, String screenshotUrl) {
        try {
            Long hitId = repository.findLatestUnattachedHitId(job.taskId(), job.subUrl(), job.keyword());
            if (hitId == null) {
                // the hit may still be waiting in the flush queue
                return StageResult.failed(FailureReasons.EMPTY_RESPONSE, "no unattached hit row");
            }
            if (!repository.attachScreenshot(hitId, screenshotUrl)) {
                return StageResult.failed(FailureReasons.EMPTY_RESPONSE, "hit row already attached");
            }
            return StageResult.ok(hitId);
        } catch (DataAccessException e) {
            return StageResult.failed(FailureReasons.IO_ERROR, e.getMessage());
        }
    }

    <T> StageResult<T> withRetries(String stage, ScreenshotJob job, Supplier<StageResult<T>> call) {
        int maxAttempts = properties.getEvidence().getStageMaxAttempts();
        long backoffMs = properties.getEvidence().getStageBackoffMs();
        StageResult<T> last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            last = call.get();
            if (last.isOk()) {
                return last;
            }
            log.debug("Screenshot {} attempt {}/{} failed url={} reason={}",
                stage, attempt, maxAttempts, job.subUrl(), last.errorCode());
            if (attempt < maxAttempts && !sleep(attempt * backoffMs)) {
                return last;
            }
        }
        return last;
    }

    private boolean fail(ScreenshotJob job, String stageError, StageResult<?> result) {
        metrics.screenshotFailure();
        log.warn("Screenshot {} for url={} keyword={} reason={} {}",
            stageError, job.subUrl(), job.keyword(), result.errorCode(), result.errorMessage());
        deadLetters.pushScreenshot(job, stageError);
        return false;
    }

    static String objectKey(ScreenshotJob job) {
        String keywordHash = HashUtils.sha256Hex(job.keyword()).substring(0, 12);
        return job.taskId() + "/" + HashUtils.sha256Hex(job.subUrl()) + "-" + keywordHash + ".png";
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
