package com.pagesentry.analyze.extract;

import com.pagesentry.analyze.model.StageResult;

import java.awt.image.BufferedImage;

public interface OcrEngine {
    boolean isAvailable();

    StageResult<String> recognize(BufferedImage image);
}
