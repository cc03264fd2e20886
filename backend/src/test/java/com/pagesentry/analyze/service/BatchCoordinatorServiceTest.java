package com.pagesentry.analyze.service;

import com.pagesentry.analyze.evidence.HitRecorder;
import com.pagesentry.analyze.http.SearchIndexClient;
import com.pagesentry.analyze.model.IngestSummary;
import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.MatchSource;
import com.pagesentry.analyze.model.PageBatch;
import com.pagesentry.analyze.model.PageContent;
import com.pagesentry.analyze.model.PageMatchResult;
import com.pagesentry.analyze.model.ResultRecord;
import com.pagesentry.analyze.model.ValidatedHit;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.validation.ValidationGate;
import com.pagesentry.config.AnalyzerProperties;
import com.pagesentry.config.RuntimeSizing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchCoordinatorServiceTest {
    private static final String MAIN = "https://shop.example.com";
    private static final String PAGE_A = MAIN + "/a";
    private static final String PAGE_B = MAIN + "/b";

    @Mock
    private PageMatcherService pageMatcher;
    @Mock
    private ValidationGate validationGate;
    @Mock
    private HitRecorder hitRecorder;
    @Mock
    private AnalyzerJdbcRepository repository;
    @Mock
    private SearchIndexClient searchIndex;

    private TaskStateStore taskState;
    private HtmlCache htmlCache;
    private BatchCoordinatorService coordinator;

    @BeforeEach
    void setUp() {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getSizing().setCores(2);
        properties.getBatch().setChunkSize(2);
        taskState = new TaskStateStore(properties);
        htmlCache = new HtmlCache(16);
        coordinator = new BatchCoordinatorService(
            pageMatcher,
            validationGate,
            hitRecorder,
            taskState,
            htmlCache,
            repository,
            searchIndex,
            Runnable::run,
            RuntimeSizing.from(properties),
            properties
        );
        lenient().when(validationGate.score(any(MatchCandidate.class))).thenReturn(1.0);
        lenient().when(validationGate.passes(anyDouble())).thenReturn(true);
    }

    @Test
    void singleShotBatchCompletesAndPersistsResult() {
        stubPage(PAGE_A, candidate("weed", "narcotics", "fresh weed"));
        stubPage(PAGE_B, candidate("upi", "payments", "pay by upi"));

        IngestSummary summary = coordinator.process(PageBatch.singleShot("task-1", MAIN, List.of(
            page(PAGE_A), page(PAGE_B), page(PAGE_A)
        )));

        assertThat(summary.status()).isEqualTo(IngestSummary.STATUS_COMPLETED);
        assertThat(summary.totalPages()).isEqualTo(2);
        assertThat(summary.totalMatches()).isEqualTo(2);
        assertThat(summary.categories()).containsExactly("narcotics", "payments");

        ArgumentCaptor<ResultRecord> record = ArgumentCaptor.forClass(ResultRecord.class);
        verify(repository).upsertResult(record.capture());
        assertThat(record.getValue().subUrls()).containsExactly(PAGE_A, PAGE_B);
        assertThat(record.getValue().snippets()).isEqualTo("fresh weed | pay by upi");
        verify(pageMatcher, times(1)).match("task-1", page(PAGE_A));
        verify(hitRecorder, times(2)).record(any(ValidatedHit.class));
        verify(searchIndex).indexSummary(eq(summary), anyList());
        assertThat(taskState.activeTasks()).isZero();
    }

    @Test
    void batchedTaskAccumulatesUntilCompletion() {
        stubPage(PAGE_A, candidate("weed", "narcotics", "fresh weed"));
        stubPage(PAGE_B, candidate("weed", "narcotics", "more weed"));

        IngestSummary first = coordinator.process(new PageBatch("task-2", MAIN, 1, false, List.of(page(PAGE_A))));
        assertThat(first.status()).isEqualTo(IngestSummary.STATUS_PROCESSING);
        assertThat(first.batchPages()).isEqualTo(1);
        verify(repository, never()).upsertResult(any());

        IngestSummary second = coordinator.process(new PageBatch("task-2", MAIN, 2, true, List.of(
            page(PAGE_B), page(PAGE_A)
        )));

        assertThat(second.status()).isEqualTo(IngestSummary.STATUS_COMPLETED);
        assertThat(second.batchNum()).isEqualTo(2);
        assertThat(second.batchPages()).isEqualTo(1);
        assertThat(second.totalPages()).isEqualTo(2);
        assertThat(second.totalMatches()).isEqualTo(2);
        verify(repository, times(1)).upsertResult(any());
    }

    @Test
    void rejectedCandidatesStillCountAsMatches() {
        when(validationGate.passes(anyDouble())).thenReturn(false);
        stubPage(PAGE_A, candidate("weed", "narcotics", "fresh weed"));

        IngestSummary summary = coordinator.process(PageBatch.singleShot("task-3", MAIN, List.of(page(PAGE_A))));

        assertThat(summary.totalMatches()).isEqualTo(1);
        verify(hitRecorder, never()).record(any());
    }

    @Test
    void hitConfidenceIsScoreTimesWeight() {
        when(validationGate.score(any(MatchCandidate.class))).thenReturn(0.8);
        stubPage(PAGE_A, new MatchCandidate("upi", "payments", "pay by upi", MatchSource.REGEX, 0.5));

        coordinator.process(PageBatch.singleShot("task-4", MAIN, List.of(page(PAGE_A))));

        ArgumentCaptor<ValidatedHit> hit = ArgumentCaptor.forClass(ValidatedHit.class);
        verify(hitRecorder).record(hit.capture());
        assertThat(hit.getValue().confidence()).isCloseTo(0.4, within(1e-9));
        assertThat(hit.getValue().source()).isEqualTo("regex");
        assertThat(hit.getValue().taskId()).isEqualTo("task-4");
    }

    @Test
    void failingPageDoesNotAbortTheBatch() {
        when(pageMatcher.match(anyString(), eq(page(PAGE_A)))).thenThrow(new IllegalStateException("boom"));
        stubPage(PAGE_B, candidate("weed", "narcotics", "fresh weed"));

        IngestSummary summary = coordinator.process(PageBatch.singleShot("task-5", MAIN, List.of(
            page(PAGE_A), page(PAGE_B)
        )));

        assertThat(summary.status()).isEqualTo(IngestSummary.STATUS_COMPLETED);
        assertThat(summary.totalPages()).isEqualTo(2);
        assertThat(summary.totalMatches()).isEqualTo(1);
    }

    @Test
    void errorEscapingPageTaskStillYieldsSummary() {
        when(pageMatcher.match(anyString(), eq(page(PAGE_A)))).thenThrow(new StackOverflowError("deep page"));
        stubPage(PAGE_B, candidate("weed", "narcotics", "fresh weed"));

        IngestSummary summary = coordinator.process(PageBatch.singleShot("task-9", MAIN, List.of(
            page(PAGE_A), page(PAGE_B)
        )));

        assertThat(summary.status()).isEqualTo(IngestSummary.STATUS_COMPLETED);
        assertThat(summary.totalPages()).isEqualTo(2);
        assertThat(summary.totalMatches()).isEqualTo(1);
    }

    @Test
    void rejectedPageExecutorStillYieldsSummary() {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getSizing().setCores(2);
        BatchCoordinatorService shutDown = new BatchCoordinatorService(
            pageMatcher,
            validationGate,
            hitRecorder,
            taskState,
            htmlCache,
            repository,
            searchIndex,
            runnable -> {
                throw new RejectedExecutionException("page executor shut down");
            },
            RuntimeSizing.from(properties),
            properties
        );

        IngestSummary summary = shutDown.process(PageBatch.singleShot("task-10", MAIN, List.of(
            page(PAGE_A), page(PAGE_B)
        )));

        assertThat(summary.isCompleted()).isTrue();
        assertThat(summary.totalPages()).isEqualTo(2);
        assertThat(summary.totalMatches()).isZero();
        verify(pageMatcher, never()).match(anyString(), any());
    }

    @Test
    void unusablePagesAreSkipped() {
        IngestSummary summary = coordinator.process(PageBatch.singleShot("task-6", MAIN, List.of(
            new PageContent(null, "<p>x</p>"), new PageContent(PAGE_A, " ")
        )));

        assertThat(summary.totalPages()).isZero();
        verify(pageMatcher, never()).match(anyString(), any());
    }

    @Test
    void resultStoreFailureStillReturnsCompletedSummary() {
        stubPage(PAGE_A, candidate("weed", "narcotics", "fresh weed"));
        doThrow(new DataAccessResourceFailureException("db down")).when(repository).upsertResult(any());

        IngestSummary summary = coordinator.process(PageBatch.singleShot("task-7", MAIN, List.of(page(PAGE_A))));

        assertThat(summary.isCompleted()).isTrue();
        assertThat(taskState.activeTasks()).isZero();
    }

    @Test
    void firstBatchRestartForgetsEarlierEvidence() {
        stubPage(PAGE_A, candidate("weed", "narcotics", "fresh weed"));
        coordinator.process(new PageBatch("task-8", MAIN, 1, false, List.of(page(PAGE_A))));
        htmlCache.put(PAGE_A, "<p>cached</p>");

        IngestSummary restarted = coordinator.process(new PageBatch("task-8", MAIN, 1, false, List.of(page(PAGE_A))));

        assertThat(restarted.totalPages()).isEqualTo(1);
        assertThat(htmlCache.get(PAGE_A)).isNull();
        verify(pageMatcher, times(2)).match("task-8", page(PAGE_A));
    }

    @Test
    void joinSnippetsDedupesAndStopsAtByteCap() {
        List<String> snippets = List.of("alpha", "beta", "alpha", "gamma");

        assertThat(BatchCoordinatorService.joinSnippets(snippets, 1000)).isEqualTo("alpha | beta | gamma");
        assertThat(BatchCoordinatorService.joinSnippets(snippets, 12)).isEqualTo("alpha | beta");
        assertThat(BatchCoordinatorService.joinSnippets(List.of("ééé"), 5)).isEmpty();
        assertThat(BatchCoordinatorService.joinSnippets(List.of(), 100)).isEmpty();
    }

    private void stubPage(String url, MatchCandidate candidate) {
        when(pageMatcher.match(anyString(), eq(page(url))))
            .thenReturn(new PageMatchResult(url, List.of(candidate), false));
    }

    private static PageContent page(String url) {
        return new PageContent(url, "<html><body>" + url + "</body></html>");
    }

    private static MatchCandidate candidate(String term, String category, String snippet) {
        return new MatchCandidate(term, category, snippet, MatchSource.REGEX, 1.0);
    }
}
