package com.pagesentry.analyze.model;

import java.util.Locale;

public enum MatchSource {
    REGEX,
    ALIAS,
    CONTEXT,
    QR,
    OCR;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
