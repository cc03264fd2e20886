package com.pagesentry.analyze.extract;

import com.pagesentry.analyze.http.ImageFetcher;
import com.pagesentry.analyze.model.FetchResult;
import com.pagesentry.analyze.model.MatchCandidate;
import com.pagesentry.analyze.model.MatchSource;
import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.rules.RuleMatcher;
import com.pagesentry.analyze.util.TextCleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Second pass over a page's images once it has shown payment signal: QR payloads are reduced to
 * UPI handles, and images without a QR handle are OCR'd and fed back through the rule matcher.
 */
@Component
public class OcrQrExtractor {
    private static final Logger log = LoggerFactory.getLogger(OcrQrExtractor.class);
    public static final String UPI_QR_TERM = "upi-qr";
    public static final String QR_SNIPPET_PREFIX = "QR->UPI:";

    private final ImageFetcher imageFetcher;
    private final QrCodeDecoder qrCodeDecoder;
    private final OcrEngine ocrEngine;
    private final RuleMatcher ruleMatcher;

    public OcrQrExtractor(
        ImageFetcher imageFetcher,
        QrCodeDecoder qrCodeDecoder,
        OcrEngine ocrEngine,
        RuleMatcher ruleMatcher
    ) {
        this.imageFetcher = imageFetcher;
        this.qrCodeDecoder = qrCodeDecoder;
        this.ocrEngine = ocrEngine;
        this.ruleMatcher = ruleMatcher;
    }

    public List<MatchCandidate> extract(String pageUrl, List<String> imageUrls) {
        List<MatchCandidate> out = new ArrayList<>();
        for (String imageUrl : imageUrls) {
            BufferedImage image = load(pageUrl, imageUrl);
            if (image == null) {
                continue;
            }
            List<MatchCandidate> qr = fromQr(qrCodeDecoder.decode(image));
            if (!qr.isEmpty()) {
                out.addAll(qr);
                continue;
            }
            if (!ocrEngine.isAvailable()) {
                continue;
            }
            StageResult<String> ocr = ocrEngine.recognize(image);
            if (!ocr.isOk()) {
                log.debug("OCR failed page={} image={} reason={}", pageUrl, imageUrl, ocr.errorCode());
                continue;
            }
            String text = TextCleaner.clean(ocr.value());
            for (MatchCandidate candidate : ruleMatcher.match(text)) {
                out.add(candidate.withSource(MatchSource.OCR));
            }
        }
        return RuleMatcher.dedupe(out);
    }

    static List<MatchCandidate> fromQr(List<String> payloads) {
        List<MatchCandidate> out = new ArrayList<>();
        for (String payload : payloads) {
            Optional<String> handle = UpiPayloadNormalizer.normalize(payload);
            handle.ifPresent(h -> out.add(new MatchCandidate(
                UPI_QR_TERM, MatchCandidate.PAYMENTS, QR_SNIPPET_PREFIX + h, MatchSource.QR, 1.0
            )));
        }
        return out;
    }

    private BufferedImage load(String pageUrl, String imageUrl) {
        FetchResult fetched = imageFetcher.fetch(imageUrl);
        if (!fetched.isSuccessful() || fetched.bodyBytes() == null || fetched.bodyBytes().length == 0) {
            log.debug("Image fetch failed page={} image={} reason={}", pageUrl, imageUrl, fetched.errorCode());
            return null;
        }
        if (fetched.truncated()) {
            log.debug("Image larger than the size cap, skipped page={} image={}", pageUrl, imageUrl);
            return null;
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(fetched.bodyBytes()));
            if (image == null) {
                log.debug("Unsupported image format page={} image={}", pageUrl, imageUrl);
            }
            return image;
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping corrupt image page={} image={}: {}", pageUrl, imageUrl, e.getMessage());
            return null;
        }
    }
}
