package com.pagesentry.analyze.extract;

import com.pagesentry.analyze.model.StageResult;
import com.pagesentry.analyze.util.FailureReasons;
import com.pagesentry.config.AnalyzerProperties;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;

class TesseractOcrEngineTest {

    @Test
    void disabledEngineNeverTouchesNativeLibrary() {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getExtraction().setOcrEnabled(false);
        TesseractOcrEngine engine = new TesseractOcrEngine(properties);

        StageResult<String> result = engine.recognize(new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB));

        assertThat(engine.isAvailable()).isFalse();
        assertThat(result.errorCode()).isEqualTo(FailureReasons.DISABLED);
    }
}
