package com.pagesentry.analyze.extract;

import com.pagesentry.analyze.http.ImageFetcher;
import com.pagesentry.analyze.model.FetchResult;
import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.MatchSource;
import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.rules.RuleMatcher;
import com.pagesentry.config.AnalyzerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OcrQrExtractorTest {
    private static final String PAGE = "https://shop.example.com/pay";

    @Mock
    private ImageFetcher imageFetcher;
    @Mock
    private QrCodeDecoder qrCodeDecoder;
    @Mock
    private OcrEngine ocrEngine;

    private OcrQrExtractor extractor;

    @BeforeEach
    void setUp() {
        RuleMatcher ruleMatcher = new RuleMatcher(List.of(), new AnalyzerProperties.Rules());
        extractor = new OcrQrExtractor(imageFetcher, qrCodeDecoder, ocrEngine, ruleMatcher);
    }

    @Test
    void qrHandleSkipsOcrForThatImage() throws Exception {
        when(imageFetcher.fetch("https://shop.example.com/qr.png")).thenReturn(png("https://shop.example.com/qr.png"));
        when(qrCodeDecoder.decode(any())).thenReturn(List.of("upi://pay?pa=Shop@okaxis&pn=Shop"));

        List<MatchCandidate> candidates = extractor.extract(PAGE, List.of("https://shop.example.com/qr.png"));

        assertThat(candidates).containsExactly(new MatchCandidate(
            OcrQrExtractor.UPI_QR_TERM, MatchCandidate.PAYMENTS, "QR->UPI:shop@okaxis", MatchSource.QR, 1.0
        ));
        verify(ocrEngine, never()).recognize(any());
    }

    @Test
    void ocrTextIsRematchedWithOcrSource() throws Exception {
        when(imageFetcher.fetch("https://shop.example.com/banner.png")).thenReturn(png("https://shop.example.com/banner.png"));
        when(qrCodeDecoder.decode(any())).thenReturn(List.of());
        when(ocrEngine.isAvailable()).thenReturn(true);
        when(ocrEngine.recognize(any())).thenReturn(StageResult.ok("scan and pay merchant@ybl send amount"));

        List<MatchCandidate> candidates = extractor.extract(PAGE, List.of("https://shop.example.com/banner.png"));

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.term()).isEqualTo(RuleMatcher.UPI_HANDLE_TERM);
            assertThat(c.source()).isEqualTo(MatchSource.OCR);
        });
    }

    @Test
    void failedFetchIsSkipped() {
        when(imageFetcher.fetch("https://shop.example.com/missing.png")).thenReturn(new FetchResult(
            "https://shop.example.com/missing.png", null, 404, null, null, false,
            Instant.now(), Duration.ZERO, "http_4xx", "not found"
        ));

        assertThat(extractor.extract(PAGE, List.of("https://shop.example.com/missing.png"))).isEmpty();
        verify(qrCodeDecoder, never()).decode(any());
    }

    @Test
    void truncatedImageIsSkipped() throws Exception {
        FetchResult full = png("https://shop.example.com/huge.png");
        when(imageFetcher.fetch("https://shop.example.com/huge.png")).thenReturn(new FetchResult(
            full.requestedUrl(), null, 200, full.bodyBytes(), "image/png", true, Instant.now(), Duration.ZERO, null, null
        ));

        assertThat(extractor.extract(PAGE, List.of("https://shop.example.com/huge.png"))).isEmpty();
        verify(qrCodeDecoder, never()).decode(any());
        verify(ocrEngine, never()).recognize(any());
    }

    @Test
    void mapsQrPayloadsToCandidates() {
        assertThat(OcrQrExtractor.fromQr(List.of("hello world", "pay vendor@ybl")))
            .extracting(MatchCandidate::snippet)
            .containsExactly("QR->UPI:vendor@ybl");
    }

    private static FetchResult png(String url) throws Exception {
        BufferedImage image = new BufferedImage(40, 40, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return new FetchResult(url, null, 200, out.toByteArray(), "image/png", false, Instant.now(), Duration.ZERO, null, null);
    }
}
