package com.pagesentry.analyze.model;

import java.util.List;

public record PageBatch(
    String taskId,
    String mainUrl,
    int batchNum,
    boolean complete,
    List<PageContent> pages
) {
    public PageBatch {
        pages = pages == null ? List.of() : List.copyOf(pages);
        batchNum = Math.max(1, batchNum);
    }

    public static PageBatch singleShot(String taskId, String mainUrl, List<PageContent> pages) {
        return new PageBatch(taskId, mainUrl, 1, true, pages);
    }
}
