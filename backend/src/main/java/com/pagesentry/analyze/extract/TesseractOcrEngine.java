package com.pagesentry.analyze.extract;

import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.config.AnalyzerProperties;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tess4j-backed OCR tuned for payment handles. Disables itself for the process lifetime if the
 * native library cannot be loaded.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {
    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);
    private static final String HANDLE_WHITELIST =
        "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789@._-";
    private static final int UPSCALE_BELOW = 300;
    private static final int SINGLE_BLOCK_PSM = 6;

    private final AnalyzerProperties.Extraction config;
    private final AtomicBoolean available;
    // Tesseract handles are not thread-safe
    private final ThreadLocal<Tesseract> tesseract;

    public TesseractOcrEngine(AnalyzerProperties properties) {
        this.config = properties.getExtraction();
        this.available = new AtomicBoolean(config.isOcrEnabled());
        this.tesseract = ThreadLocal.withInitial(this::newTesseract);
    }

    @Override
    public boolean isAvailable() {
        return available.get();
    }

    @Override
    public StageResult<String> recognize(BufferedImage image) {
        if (!available.get()) {
            return StageResult.failed(FailureReasons.DISABLED, "ocr disabled");
        }
        try {
            String text = tesseract.get().doOCR(prepare(image));
            return StageResult.ok(text == null ? "" : text);
        } catch (TesseractException e) {
            return StageResult.failed(FailureReasons.PARSE_ERROR, e.getMessage());
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            if (available.compareAndSet(true, false)) {
                log.warn("Tesseract native library unavailable, OCR disabled: {}", e.getMessage());
            }
            return StageResult.failed(FailureReasons.DISABLED, e.getMessage());
        }
    }

    private Tesseract newTesseract() {
        Tesseract instance = new Tesseract();
        instance.setDatapath(config.getTessDataPath());
        instance.setLanguage(config.getOcrLanguage());
        instance.setPageSegMode(SINGLE_BLOCK_PSM);
        instance.setVariable("tessedit_char_whitelist", HANDLE_WHITELIST);
        return instance;
    }

    static BufferedImage prepare(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        int scale = (width < UPSCALE_BELOW || height < UPSCALE_BELOW) ? 2 : 1;
        BufferedImage gray = new BufferedImage(width * scale, height * scale, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D graphics = gray.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(source, 0, 0, width * scale, height * scale, null);
        } finally {
            graphics.dispose();
        }
        return gray;
    }
}
