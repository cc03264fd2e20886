package com.pagesentry.analyze.service;

import com.pagesentry.analyze.evidence.AnalyzerMetrics;
import com.pagesentry.analyze.extract.OcrQrExtractor;
import com.pagesentry.analyze.extract.PageTextExtractor;
import com.pagesentry.analyze.http.RenderServiceClient;
import com.pagesentry.analyze.model.KeywordRule;
import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.MatchSource;
import com.pagesentry.analyze.model.PageContent;
import com.pagesentry.analyze.model.PageMatchResult;
import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.policy.DomainPolicyService;
import com.pagesentry.analyze.rules.RuleMatcher;
import com.pagesentry.analyze.storage.HtmlArchiver;
import com.pagesentry.config.AnalyzerProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PageMatcherServiceTest {
    private static final String URL = "https://shop.example.com/item";
    private static final String EMPTY_SHELL = "<html><body><div id=\"root\"></div></body></html>";
    private static final String WEED_PAGE = "<html><body><p>Fresh weed delivered to your door</p></body></html>";

    @Mock
    private OcrQrExtractor ocrQrExtractor;
    @Mock
    private RenderServiceClient renderClient;
    @Mock
    private DomainPolicyService domainPolicy;
    @Mock
    private AnalyzerJdbcRepository repository;
    @Mock
    private HtmlArchiver archiver;

    private HtmlCache htmlCache;
    private AnalyzerMetrics metrics;
    private PageMatcherService service;

    @BeforeEach
    void setUp() {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getEscalation().setMinTextLength(200);
        RuleMatcher ruleMatcher = new RuleMatcher(
            List.of(new KeywordRule("weed", "narcotics", List.of("\\bweed\\b"), List.of(), List.of())),
            properties.getRules()
        );
        htmlCache = new HtmlCache(16);
        metrics = new AnalyzerMetrics(new SimpleMeterRegistry());
        service = new PageMatcherService(
            new PageTextExtractor(properties),
            ruleMatcher,
            ocrQrExtractor,
            renderClient,
            domainPolicy,
            repository,
            archiver,
            htmlCache,
            metrics,
            Runnable::run,
            properties
        );
    }

    @Test
    void forcedDomainIsMatchedOnRenderedHtml() {
        when(renderClient.isEnabled()).thenReturn(true);
        when(domainPolicy.isForced(URL)).thenReturn(true);
        when(renderClient.render(URL)).thenReturn(StageResult.ok(WEED_PAGE));

        PageMatchResult result = service.match("task-1", new PageContent(URL, EMPTY_SHELL));

        assertThat(result.rendered()).isTrue();
        assertThat(result.candidates()).extracting(MatchCandidate::term).containsExactly("weed");
        assertThat(htmlCache.get(URL)).isEqualTo(WEED_PAGE);
        verify(domainPolicy, never()).recordRenderSuccess(anyString());
    }

    @Test
    void forcedRenderFailureFallsBackToOriginalHtml() {
        when(renderClient.isEnabled()).thenReturn(true);
        when(domainPolicy.isForced(URL)).thenReturn(true);
        when(renderClient.render(URL)).thenReturn(StageResult.failed("timeout", "slow"));

        PageMatchResult result = service.match("task-1", new PageContent(URL, WEED_PAGE));

        assertThat(result.rendered()).isFalse();
        assertThat(result.candidates()).extracting(MatchCandidate::term).containsExactly("weed");
        assertThat(metrics.snapshot()).containsEntry("renderer_failures", 1.0);
    }

    @Test
    void opportunisticRenderThatFindsNewMatchesRecordsSuccess() {
        when(renderClient.isEnabled()).thenReturn(true);
        when(domainPolicy.isForced(URL)).thenReturn(false);
        when(renderClient.render(URL)).thenReturn(StageResult.ok(WEED_PAGE));

        PageMatchResult result = service.match("task-1", new PageContent(URL, EMPTY_SHELL));

        assertThat(result.rendered()).isTrue();
        assertThat(result.candidates()).extracting(MatchCandidate::term).containsExactly("weed");
        verify(domainPolicy).recordRenderSuccess(URL);
    }

    @Test
    void opportunisticRenderWithoutImprovementIsDiscarded() {
        when(renderClient.isEnabled()).thenReturn(true);
        when(domainPolicy.isForced(URL)).thenReturn(false);
        when(renderClient.render(URL)).thenReturn(StageResult.ok("<html><body><p>Loading</p></body></html>"));

        PageMatchResult result = service.match("task-1", new PageContent(URL, EMPTY_SHELL));

        assertThat(result.rendered()).isFalse();
        assertThat(result.candidates()).isEmpty();
        assertThat(htmlCache.get(URL)).isEqualTo(EMPTY_SHELL);
        verify(domainPolicy, never()).recordRenderSuccess(anyString());
    }

    @Test
    void pageWithEnoughTextIsNotRendered() {
        String longText = "<html><body><p>" + "garden tools and seeds ".repeat(20) + "</p></body></html>";
        when(renderClient.isEnabled()).thenReturn(true);
        when(domainPolicy.isForced(URL)).thenReturn(false);

        PageMatchResult result = service.match("task-1", new PageContent(URL, longText));

        assertThat(result.rendered()).isFalse();
        verify(renderClient, never()).render(anyString());
    }

    @Test
    void disabledRendererSkipsForcedAndOpportunisticRendering() {
        when(renderClient.isEnabled()).thenReturn(false);

        service.match("task-1", new PageContent(URL, EMPTY_SHELL));

        verify(domainPolicy, never()).isForced(anyString());
        verify(renderClient, never()).render(anyString());
        verify(domainPolicy).recordSeen(URL);
    }

    @Test
    void paymentPagesRunImageExtractionAndRecordUpiHandles() {
        String html = "<html><body><p>send to merchant@upi pay now buy</p>"
            + "<img src=\"https://cdn.example.com/qr.png\"></body></html>";
        when(renderClient.isEnabled()).thenReturn(false);
        when(ocrQrExtractor.extract(URL, List.of("https://cdn.example.com/qr.png"))).thenReturn(List.of(
            new MatchCandidate(OcrQrExtractor.UPI_QR_TERM, MatchCandidate.PAYMENTS,
                OcrQrExtractor.QR_SNIPPET_PREFIX + "shop@ybl", MatchSource.QR, 0.9)
        ));

        PageMatchResult result = service.match("task-1", new PageContent(URL, html));

        assertThat(result.candidates()).extracting(MatchCandidate::term)
            .contains(RuleMatcher.UPI_HANDLE_TERM, OcrQrExtractor.UPI_QR_TERM);
        verify(repository).recordUpiHandle("merchant@upi", "shop.example.com", URL);
        verify(repository).recordUpiHandle("shop@ybl", "shop.example.com", URL);
    }

    @Test
    void pagesWithoutPaymentMatchesSkipImageExtraction() {
        String html = "<html><body><p>Fresh weed</p><img src=\"https://cdn.example.com/a.png\"></body></html>";
        when(renderClient.isEnabled()).thenReturn(false);

        service.match("task-1", new PageContent(URL, html));

        verify(ocrQrExtractor, never()).extract(anyString(), any());
    }

    @Test
    void htmlIsArchivedOncePerCachedUrl() {
        when(renderClient.isEnabled()).thenReturn(false);
        when(archiver.isEnabled()).thenReturn(true);

        service.match("task-1", new PageContent(URL, WEED_PAGE));
        service.match("task-1", new PageContent(URL, WEED_PAGE));

        verify(archiver, times(1)).archive(eq("task-1"), eq(URL), eq(WEED_PAGE));
        assertThat(htmlCache.isPersisted(URL)).isTrue();
    }
}
