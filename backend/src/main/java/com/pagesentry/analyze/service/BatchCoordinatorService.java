package com.pagesentry.analyze.service;

import com.pagesentry.analyze.evidence.HitRecorder;
import com.pagesentry.analyze.http.SearchIndexClient;
import com.pagesentry.analyze.model.IngestSummary;
import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.PageBatch;
import com.pagesentry.analyze.model.PageContent;
import com.pagesentry.analyze.model.PageMatchResult;
import com.pagesentry.analyze.model.ResultRecord;
import com.pagesentry.analyze.model.ValidatedHit;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.validation.ValidationGate;
import com.pagesentry.config.AnalyzerProperties;
import com.pagesentry.config.RuntimeSizing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the ingest pipeline. Folds each batch of a task into its accumulator, runs pages
 * through {@link PageMatcherService} under a shared concurrency limit, routes candidates through
 * the validation gate into evidence recording, and writes the result record once the task completes.
 * Never throws to its caller.
 */
@Service
public class BatchCoordinatorService {
    private static final Logger log = LoggerFactory.getLogger(BatchCoordinatorService.class);
    static final String SNIPPET_SEPARATOR = " | ";

    private final PageMatcherService pageMatcher;
    private final ValidationGate validationGate;
    private final HitRecorder hitRecorder;
    private final TaskStateStore taskState;
    private final HtmlCache htmlCache;
    private final AnalyzerJdbcRepository repository;
    private final SearchIndexClient searchIndex;
    private final Executor pageExecutor;
    private final Semaphore pageLimiter;
    private final int chunkSize;
    private final int snippetCapBytes;

    public BatchCoordinatorService(
        PageMatcherService pageMatcher,
        ValidationGate validationGate,
        HitRecorder hitRecorder,
        TaskStateStore taskState,
        HtmlCache htmlCache,
        AnalyzerJdbcRepository repository,
        SearchIndexClient searchIndex,
        @Qualifier("pageExecutor") Executor pageExecutor,
        RuntimeSizing sizing,
        AnalyzerProperties properties
    ) {
        this.pageMatcher = pageMatcher;
        this.validationGate = validationGate;
        this.hitRecorder = hitRecorder;
        this.taskState = taskState;
        this.htmlCache = htmlCache;
        this.repository = repository;
        this.searchIndex = searchIndex;
        this.pageExecutor = pageExecutor;
        this.pageLimiter = new Semaphore(sizing.pageConcurrency());
        this.chunkSize = properties.getBatch().getChunkSize();
        this.snippetCapBytes = properties.getBatch().getSnippetCapBytes();
    }

    public IngestSummary process(PageBatch batch) {
        String taskId = batch.taskId();
        String mainUrl = batch.mainUrl();
        long startedAt = System.currentTimeMillis();

        BatchAccumulator.Snapshot discarded = taskState.begin(taskId, mainUrl, batch.batchNum());
        if (discarded != null) {
            log.info("Resetting task={} on batch 1 (discarding {} pages)", taskId, discarded.totalPages());
            discardTaskState(discarded);
        }
        if (batch.batchNum() == 1) {
            hitRecorder.forget(mainUrl);
        }
        log.info("Batch start task={} main_url={} batch={} pages={} complete={}",
            taskId, mainUrl, batch.batchNum(), batch.pages().size(), batch.complete());

        AtomicInteger batchPages = new AtomicInteger();
        AtomicInteger batchMatches = new AtomicInteger();
        List<PageContent> pages = claimPages(taskId, batch.pages());
        for (int from = 0; from < pages.size(); from += chunkSize) {
            List<PageContent> chunk = pages.subList(from, Math.min(pages.size(), from + chunkSize));
            List<CompletableFuture<Void>> futures = new ArrayList<>(chunk.size());
            for (PageContent page : chunk) {
                futures.add(submitPage(taskId, mainUrl, page, batchPages, batchMatches));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            log.debug("Chunk done task={} pages={}-{}", taskId, from, from + chunk.size());
        }

        IngestSummary summary = batch.complete()
            ? complete(taskId, mainUrl, batch.batchNum(), batchPages.get(), batchMatches.get())
            : processing(taskId, mainUrl, batch.batchNum(), batchPages.get(), batchMatches.get());
        log.info("Batch done task={} batch={} status={} pages={} matches={} durationMs={}",
            taskId, batch.batchNum(), summary.status(), summary.totalPages(), summary.totalMatches(),
            System.currentTimeMillis() - startedAt);
        return summary;
    }

    private List<PageContent> claimPages(String taskId, List<PageContent> pages) {
        List<PageContent> claimed = new ArrayList<>();
        for (PageContent page : pages) {
            if (!page.isUsable()) {
                log.warn("Skipping page without url or html task={} url={}", taskId, page.url());
                continue;
            }
            if (!taskState.claimPage(taskId, page.url())) {
                log.debug("Skipping duplicate page task={} url={}", taskId, page.url());
                continue;
            }
            claimed.add(page);
        }
        return claimed;
    }

    /**
     * Never completes exceptionally: a rejected submission or an error escaping the page task is
     * logged and the page is counted with no matches.
     */
    private CompletableFuture<Void> submitPage(
        String taskId,
        String mainUrl,
        PageContent page,
        AtomicInteger batchPages,
        AtomicInteger batchMatches
    ) {
        CompletableFuture<Void> task;
        try {
            task = CompletableFuture.runAsync(
                () -> processPage(taskId, mainUrl, page, batchPages, batchMatches),
                pageExecutor
            );
        } catch (RejectedExecutionException e) {
            task = CompletableFuture.failedFuture(e);
        }
        return task.handle((ignored, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                log.error("Page aborted task={} url={}: {}", taskId, page.url(), cause.toString(), cause);
                countFailedPage(taskId, page, batchPages);
            }
            return null;
        });
    }

    private void countFailedPage(String taskId, PageContent page, AtomicInteger batchPages) {
        taskState.fold(taskId, page.url(), List.of());
        batchPages.incrementAndGet();
    }

    void processPage(
        String taskId,
        String mainUrl,
        PageContent page,
        AtomicInteger batchPages,
        AtomicInteger batchMatches
    ) {
        boolean acquired = false;
        try {
            pageLimiter.acquire();
            acquired = true;
            PageMatchResult result = pageMatcher.match(taskId, page);
            int added = taskState.fold(taskId, page.url(), result.candidates());
            batchPages.incrementAndGet();
            batchMatches.addAndGet(added);
            for (MatchCandidate candidate : result.candidates()) {
                validateAndRecord(taskId, mainUrl, page.url(), candidate);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted before processing task={} url={}", taskId, page.url());
        } catch (RuntimeException e) {
            log.warn("Page failed task={} url={}: {}", taskId, page.url(), e.getMessage(), e);
            countFailedPage(taskId, page, batchPages);
        } finally {
            if (acquired) {
                pageLimiter.release();
            }
        }
    }

    private void validateAndRecord(String taskId, String mainUrl, String subUrl, MatchCandidate candidate) {
        double score = validationGate.score(candidate);
        if (!validationGate.passes(score)) {
            log.debug("Validation rejected task={} url={} keyword={} score={}", taskId, subUrl, candidate.term(), score);
            return;
        }
        hitRecorder.record(new ValidatedHit(
            taskId,
            mainUrl,
            subUrl,
            candidate.category(),
            candidate.term(),
            candidate.snippet(),
            candidate.source().code(),
            score * candidate.weight(),
            null,
            Instant.now()
        ));
    }

    private IngestSummary processing(String taskId, String mainUrl, int batchNum, int batchPages, int batchMatches) {
        BatchAccumulator.Snapshot snapshot = taskState.snapshot(taskId);
        int totalPages = snapshot == null ? batchPages : snapshot.totalPages();
        int totalMatches = snapshot == null ? batchMatches : snapshot.totalMatches();
        List<String> categories = snapshot == null ? List.of() : snapshot.categories();
        return new IngestSummary(
            taskId, mainUrl, totalPages, totalMatches, categories, IngestSummary.STATUS_PROCESSING,
            batchNum, batchPages, batchMatches, validationGate.isActive()
        );
    }

    private IngestSummary complete(String taskId, String mainUrl, int batchNum, int batchPages, int batchMatches) {
        BatchAccumulator.Snapshot snapshot = taskState.finish(taskId);
        if (snapshot == null) {
            log.warn("No accumulator for completed task={}", taskId);
            return new IngestSummary(
                taskId, mainUrl, 0, 0, List.of(), IngestSummary.STATUS_COMPLETED,
                batchNum, batchPages, batchMatches, validationGate.isActive()
            );
        }
        ResultRecord record = new ResultRecord(
            taskId,
            mainUrl,
            snapshot.subUrls(),
            snapshot.keywords(),
            snapshot.categories(),
            joinSnippets(snapshot.snippets(), snippetCapBytes),
            snapshot.totalPages(),
            snapshot.totalMatches(),
            Instant.now()
        );
        try {
            repository.upsertResult(record);
            log.info("Result saved task={} main_url={} matches={}", taskId, mainUrl, snapshot.totalMatches());
        } catch (DataAccessException e) {
            log.error("Failed to save result task={} main_url={} pages={} matches={}",
                taskId, mainUrl, snapshot.totalPages(), snapshot.totalMatches(), e);
        }

        IngestSummary summary = new IngestSummary(
            taskId, mainUrl, snapshot.totalPages(), snapshot.totalMatches(), snapshot.categories(),
            IngestSummary.STATUS_COMPLETED, batchNum, batchPages, batchMatches, validationGate.isActive()
        );
        searchIndex.indexSummary(summary, snapshot.keywords());
        discardTaskState(snapshot);
        return summary;
    }

    private void discardTaskState(BatchAccumulator.Snapshot snapshot) {
        hitRecorder.forget(snapshot.mainUrl());
        htmlCache.evictAll(snapshot.subUrls());
    }

    /**
     * Joins snippets in order, stopping before the UTF-8 size would exceed {@code capBytes}.
     */
    static String joinSnippets(List<String> snippets, int capBytes) {
        StringBuilder out = new StringBuilder();
        int bytes = 0;
        int separatorBytes = SNIPPET_SEPARATOR.getBytes(StandardCharsets.UTF_8).length;
        Set<String> unique = new LinkedHashSet<>(snippets);
        for (String snippet : unique) {
            int size = snippet.getBytes(StandardCharsets.UTF_8).length + (out.length() == 0 ? 0 : separatorBytes);
            if (bytes + size > capBytes) {
                break;
            }
            if (out.length() > 0) {
                out.append(SNIPPET_SEPARATOR);
            }
            out.append(snippet);
            bytes += size;
        }
        return out.toString();
    }
}
