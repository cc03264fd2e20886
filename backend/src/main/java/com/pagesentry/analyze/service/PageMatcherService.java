package com.pagesentry.analyze.service;

import com.pagesentry.analyze.evidence.AnalyzerMetrics;
import com.pagesentry.analyze.extract.OcrQrExtractor;
import com.pagesentry.analyze.extract.PageTextExtractor;
import com.pagesentry.analyze.http.RenderServiceClient;
import com.pagesentry.analyze.model.ExtractedPage;
import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.PageContent;
import com.pagesentry.analyze.model.PageMatchResult;
import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.persistence.AnalyzerJdbcRepository;
import com.pagesentry.analyze.policy.DomainPolicyService;
import com.pagesentry.analyze.rules.RuleMatcher;
import com.pagesentry.analyze.storage.HtmlArchiver;
import com.pagesentry.analyze.util.UrlUtils;
import com.pagesentry.config.AnalyzerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Turns one page into match candidates: optional forced render, extraction, rule matching,
 * image OCR/QR for payment pages, and the opportunistic render that feeds domain escalation.
 */
@Service
public class PageMatcherService {
    private static final Logger log = LoggerFactory.getLogger(PageMatcherService.class);
    private static final int MATERIAL_TEXT_FACTOR = 2;

    private final PageTextExtractor extractor;
    private final RuleMatcher ruleMatcher;
    private final OcrQrExtractor ocrQrExtractor;
    private final RenderServiceClient renderClient;
    private final DomainPolicyService domainPolicy;
    private final AnalyzerJdbcRepository repository;
    private final HtmlArchiver archiver;
    private final HtmlCache htmlCache;
    private final AnalyzerMetrics metrics;
    private final Executor cpuExecutor;
    private final int minTextLength;

    public PageMatcherService(
        PageTextExtractor extractor,
        RuleMatcher ruleMatcher,
        OcrQrExtractor ocrQrExtractor,
        RenderServiceClient renderClient,
        DomainPolicyService domainPolicy,
        AnalyzerJdbcRepository repository,
        HtmlArchiver archiver,
        HtmlCache htmlCache,
        AnalyzerMetrics metrics,
        @Qualifier("cpuExecutor") Executor cpuExecutor,
        AnalyzerProperties properties
    ) {
        this.extractor = extractor;
        this.ruleMatcher = ruleMatcher;
        this.ocrQrExtractor = ocrQrExtractor;
        this.renderClient = renderClient;
        this.domainPolicy = domainPolicy;
        this.repository = repository;
        this.archiver = archiver;
        this.htmlCache = htmlCache;
        this.metrics = metrics;
        this.cpuExecutor = cpuExecutor;
        this.minTextLength = properties.getEscalation().getMinTextLength();
    }

    public PageMatchResult match(String taskId, PageContent page) {
        String url = page.url();
        domainPolicy.recordSeen(url);

        String html = page.html();
        boolean rendered = false;
        boolean forced = renderClient.isEnabled() && domainPolicy.isForced(url);
        if (forced) {
            StageResult<String> render = render(url, "forced");
            if (render.isOk()) {
                html = render.value();
                rendered = true;
            }
        }

        Analysis analysis = analyze(url, html);
        List<MatchCandidate> candidates = new ArrayList<>(analysis.candidates());

        if (!forced && shouldEscalate(analysis)) {
            log.debug(
                "Opportunistic render url={} textLength={} frameworkMarkers={}",
                url,
                analysis.page().textLength(),
                analysis.page().frameworkMarkers()
            );
            StageResult<String> render = render(url, "opportunistic");
            if (render.isOk()) {
                Analysis after = analyze(url, render.value());
                if (isImprovement(analysis, after)) {
                    domainPolicy.recordRenderSuccess(url);
                    html = render.value();
                    rendered = true;
                    candidates.addAll(after.candidates());
                }
            }
        }

        List<MatchCandidate> unique = RuleMatcher.dedupe(candidates);
        recordUpiHandles(url, unique);
        archive(taskId, url, html);
        return new PageMatchResult(url, unique, rendered);
    }

    boolean shouldEscalate(Analysis analysis) {
        return renderClient.isEnabled()
            && analysis.candidates().isEmpty()
            && analysis.page().textLength() < minTextLength;
    }

    boolean isImprovement(Analysis before, Analysis after) {
        Set<String> known = new HashSet<>();
        for (MatchCandidate candidate : before.candidates()) {
            known.add(candidate.dedupeKey());
        }
        for (MatchCandidate candidate : after.candidates()) {
            if (!known.contains(candidate.dedupeKey())) {
                return true;
            }
        }
        int beforeLength = before.page().textLength();
        int afterLength = after.page().textLength();
        return afterLength >= minTextLength && afterLength >= beforeLength * MATERIAL_TEXT_FACTOR;
    }

    Analysis analyze(String url, String html) {
        ExtractedPage page;
        List<MatchCandidate> candidates;
        try {
            Analysis textPass = CompletableFuture.supplyAsync(() -> {
                ExtractedPage extracted = extractor.extract(url, html);
                return new Analysis(extracted, ruleMatcher.match(extracted.text()));
            }, cpuExecutor).join();
            page = textPass.page();
            candidates = new ArrayList<>(textPass.candidates());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
        if (hasPayments(candidates) && !page.imageUrls().isEmpty()) {
            candidates.addAll(ocrQrExtractor.extract(url, page.imageUrls()));
        }
        return new Analysis(page, RuleMatcher.dedupe(candidates));
    }

    private StageResult<String> render(String url, String reason) {
        StageResult<String> render = renderClient.render(url);
        if (!render.isOk()) {
            metrics.rendererFailure();
            log.warn("Render failed url={} mode={} reason={} detail={}", url, reason, render.errorCode(), render.errorMessage());
        }
        return render;
    }

    private void recordUpiHandles(String url, List<MatchCandidate> candidates) {
        String domain = UrlUtils.domainOf(url);
        if (domain == null) {
            return;
        }
        Set<String> handles = new HashSet<>();
        for (MatchCandidate candidate : candidates) {
            if (RuleMatcher.UPI_HANDLE_TERM.equals(candidate.term())) {
                handles.addAll(RuleMatcher.upiHandlesIn(candidate.snippet()));
            } else if (OcrQrExtractor.UPI_QR_TERM.equals(candidate.term())
                && candidate.snippet().startsWith(OcrQrExtractor.QR_SNIPPET_PREFIX)) {
                handles.add(candidate.snippet().substring(OcrQrExtractor.QR_SNIPPET_PREFIX.length()));
            }
        }
        for (String handle : handles) {
            try {
                repository.recordUpiHandle(handle, domain, url);
            } catch (DataAccessException e) {
                log.warn("Failed to record UPI handle={} domain={}: {}", handle, domain, e.getMessage());
            }
        }
    }

    private void archive(String taskId, String url, String html) {
        htmlCache.put(url, html);
        if (archiver.isEnabled() && htmlCache.markPersisted(url)) {
            archiver.archive(taskId, url, html);
        }
    }

    private static boolean hasPayments(List<MatchCandidate> candidates) {
        for (MatchCandidate candidate : candidates) {
            if (candidate.isPayments()) {
                return true;
            }
        }
        return false;
    }

    record Analysis(ExtractedPage page, List<MatchCandidate> candidates) {
    }
}
